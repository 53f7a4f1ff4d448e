package io.github.drompincen.clawguard.tools;

import io.github.drompincen.clawguard.protocol.api.SandboxRootConfig;
import io.github.drompincen.clawguard.runtime.errors.ConfigurationException;
import io.github.drompincen.clawguard.runtime.errors.SandboxViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Filesystem access confined to named roots. Paths are written {@code root/relative} or
 * {@code root:relative}; anything that does not land strictly inside its root, symlinks
 * included, is refused with a {@link SandboxViolationException}.
 */
public class FileSandbox {

    private static final Logger log = LoggerFactory.getLogger(FileSandbox.class);

    public static final int DEFAULT_MAX_READ_CHARS = 20_000;

    public record Location(String rootName, Path path, String relative) {
        public String display() {
            return relative.isEmpty() ? rootName + "/" : rootName + "/" + relative;
        }
    }

    private record Root(SandboxRootConfig config, Path path) {}

    private final Map<String, Root> roots = new LinkedHashMap<>();

    public FileSandbox(List<SandboxRootConfig> configs) {
        if (configs == null || configs.isEmpty()) {
            throw new ConfigurationException("A file sandbox needs at least one root");
        }
        for (SandboxRootConfig config : configs) {
            if (roots.containsKey(config.name())) {
                throw new ConfigurationException("Duplicate sandbox root name: " + config.name());
            }
            Path path;
            try {
                path = Path.of(config.root()).toAbsolutePath().normalize();
                Files.createDirectories(path);
                path = path.toRealPath();
            } catch (IOException e) {
                throw new ConfigurationException("Cannot create sandbox root '" + config.name() + "' at " + config.root(), e);
            }
            roots.put(config.name(), new Root(config, path));
            log.debug("Sandbox root {} -> {} ({})", config.name(), path, config.mode());
        }
    }

    public Collection<SandboxRootConfig> roots() {
        return roots.values().stream().map(Root::config).toList();
    }

    public boolean hasRoot(String name) {
        return roots.containsKey(name);
    }

    public Path rootPath(String name) {
        Root root = roots.get(name);
        if (root == null) throw new ConfigurationException("Unknown sandbox root: " + name);
        return root.path();
    }

    public SandboxRootConfig rootConfig(String name) {
        Root root = roots.get(name);
        if (root == null) throw new ConfigurationException("Unknown sandbox root: " + name);
        return root.config();
    }

    /** Resolves a path that must name something strictly inside a root. */
    public Location resolve(String pathSpec) {
        return locate(pathSpec, false);
    }

    /** Like {@link #resolve} but also accepts a bare root name. */
    public Location locate(String pathSpec, boolean allowRootItself) {
        if (pathSpec == null || pathSpec.isBlank()) {
            throw outside(pathSpec);
        }
        try {
            return locateChecked(pathSpec, allowRootItself);
        } catch (InvalidPathException e) {
            throw new SandboxViolationException(pathSpec, SandboxViolationException.Kind.NOT_IN_SANDBOX,
                    "Cannot access '" + pathSpec + "': invalid path (" + e.getReason() + ").\nReadable paths: "
                            + String.join(", ", readableRoots()));
        } catch (UncheckedIOException e) {
            throw new SandboxViolationException(pathSpec, SandboxViolationException.Kind.NOT_IN_SANDBOX,
                    "Cannot access '" + pathSpec + "': " + e.getCause().getMessage());
        }
    }

    private Location locateChecked(String pathSpec, boolean allowRootItself) {
        String spec = pathSpec.trim().replace('\\', '/');
        if (spec.startsWith("/") || spec.startsWith("~") || Path.of(spec).isAbsolute()) {
            throw outside(pathSpec);
        }

        String rootName;
        String rel;
        int slash = spec.indexOf('/');
        int colon = spec.indexOf(':');
        if (colon > 0 && (slash < 0 || colon < slash)) {
            rootName = spec.substring(0, colon);
            rel = spec.substring(colon + 1);
        } else if (slash > 0) {
            rootName = spec.substring(0, slash);
            rel = spec.substring(slash + 1);
        } else {
            rootName = spec;
            rel = "";
        }

        Root root = roots.get(rootName);
        if (root == null) {
            throw outside(pathSpec);
        }
        if (rel.startsWith("/") || rel.startsWith("~")) {
            throw escape(pathSpec, rootName);
        }

        Path candidate = root.path().resolve(rel).normalize();
        if (!candidate.startsWith(root.path())) {
            throw escape(pathSpec, rootName);
        }
        if (!realPath(candidate).startsWith(root.path())) {
            throw escape(pathSpec, rootName);
        }
        if (candidate.equals(root.path()) && !allowRootItself) {
            throw new SandboxViolationException(pathSpec, SandboxViolationException.Kind.NOT_IN_SANDBOX,
                    "Cannot access '" + pathSpec + "': it names the sandbox root itself; name a file inside "
                            + rootName + "/");
        }
        String relative = root.path().relativize(candidate).toString().replace('\\', '/');
        return new Location(rootName, candidate, relative);
    }

    public ReadResult read(String pathSpec) throws IOException {
        return read(pathSpec, DEFAULT_MAX_READ_CHARS, 0);
    }

    public ReadResult read(String pathSpec, int maxChars, int offset) throws IOException {
        if (maxChars <= 0) throw new IllegalArgumentException("maxChars must be positive: " + maxChars);
        if (offset < 0) throw new IllegalArgumentException("offset must not be negative: " + offset);

        Location location = resolve(pathSpec);
        Root root = roots.get(location.rootName());
        checkSuffix(pathSpec, location, root, "read");
        if (Files.isDirectory(location.path())) {
            throw new IOException(location.display() + " is a directory; use list_files");
        }
        long size = Files.size(location.path());
        Long limit = root.config().maxFileBytes();
        if (limit != null && size > limit) {
            throw new SandboxViolationException(pathSpec, SandboxViolationException.Kind.TOO_LARGE,
                    "Cannot read '" + pathSpec + "': file too large (" + size + " bytes, limit " + limit + " bytes)");
        }

        String text = Files.readString(location.path(), StandardCharsets.UTF_8);
        int total = text.length();
        int start = Math.min(offset, total);
        int end = (int) Math.min((long) start + maxChars, total);
        String window = text.substring(start, end);
        return new ReadResult(window, end < total, total, start, window.length());
    }

    /** Fails unless {@code pathSpec} may be written; checked before any approval is asked for. */
    public Location checkWritable(String pathSpec) {
        Location location = resolve(pathSpec);
        Root root = roots.get(location.rootName());
        if (!root.config().writable()) {
            String writable = writableRoots().isEmpty() ? "(none)" : String.join(", ", writableRoots());
            throw new SandboxViolationException(pathSpec, SandboxViolationException.Kind.READ_ONLY,
                    "Cannot write to '" + pathSpec + "': path is read-only.\nWritable paths: " + writable);
        }
        checkSuffix(pathSpec, location, root, "write");
        return location;
    }

    public String write(String pathSpec, String content) throws IOException {
        Location location = checkWritable(pathSpec);
        Root root = roots.get(location.rootName());
        String text = content == null ? "" : content;
        Long limit = root.config().maxFileBytes();
        int bytes = text.getBytes(StandardCharsets.UTF_8).length;
        if (limit != null && bytes > limit) {
            throw new SandboxViolationException(pathSpec, SandboxViolationException.Kind.TOO_LARGE,
                    "Cannot write to '" + pathSpec + "': content too large (" + bytes + " bytes, limit " + limit + " bytes)");
        }
        Path parent = location.path().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(location.path(), text, StandardCharsets.UTF_8);
        log.debug("Wrote {} chars to {}", text.length(), location.display());
        return "Written " + text.length() + " characters to " + location.display();
    }

    /**
     * Lists files under a root or directory as sorted {@code root/relative} paths.
     * {@code "."} or an empty path lists every root.
     */
    public List<String> list(String pathSpec, String glob) throws IOException {
        String pattern = glob == null || glob.isBlank() ? "**/*" : glob;
        List<String> result = new ArrayList<>();
        if (pathSpec == null || pathSpec.isBlank() || ".".equals(pathSpec.trim())) {
            for (String name : roots.keySet()) {
                collect(name, roots.get(name).path(), pattern, result);
            }
        } else {
            Location location = locate(pathSpec, true);
            if (Files.isRegularFile(location.path())) {
                result.add(location.display());
            } else {
                collect(location.rootName(), location.path(), pattern, result);
            }
        }
        result.sort(null);
        return result;
    }

    public List<String> readableRoots() {
        return roots.keySet().stream().map(name -> name + "/").collect(Collectors.toList());
    }

    public List<String> writableRoots() {
        return roots.values().stream()
                .filter(r -> r.config().writable())
                .map(r -> r.config().name() + "/")
                .collect(Collectors.toList());
    }

    private void collect(String rootName, Path base, String pattern, List<String> out) throws IOException {
        if (!Files.isDirectory(base)) return;
        Path rootPath = roots.get(rootName).path();
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        PathMatcher shallow = pattern.startsWith("**/")
                ? FileSystems.getDefault().getPathMatcher("glob:" + pattern.substring(3)) : null;
        try (Stream<Path> walk = Files.walk(base)) {
            walk.filter(Files::isRegularFile)
                    .filter(p -> realPath(p).startsWith(rootPath))
                    .filter(p -> {
                        Path rel = base.relativize(p);
                        return matcher.matches(rel) || (shallow != null && shallow.matches(rel));
                    })
                    .forEach(p -> out.add(rootName + "/" + rootPath.relativize(p).toString().replace('\\', '/')));
        }
    }

    private void checkSuffix(String pathSpec, Location location, Root root, String verb) {
        List<String> allowed = root.config().suffixes();
        if (allowed == null) return;
        String fileName = location.path().getFileName().toString().toLowerCase(Locale.ROOT);
        for (String suffix : allowed) {
            if (fileName.endsWith(suffix.toLowerCase(Locale.ROOT))) return;
        }
        int dot = fileName.lastIndexOf('.');
        String actual = dot >= 0 ? fileName.substring(dot) : "(none)";
        throw new SandboxViolationException(pathSpec, SandboxViolationException.Kind.SUFFIX_NOT_ALLOWED,
                "Cannot " + verb + " '" + pathSpec + "': suffix '" + actual + "' not allowed.\nAllowed suffixes: "
                        + String.join(", ", allowed));
    }

    /** Real path of the deepest existing ancestor, with the missing tail re-attached. */
    private static Path realPath(Path candidate) {
        Path existing = candidate;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null) return candidate;
        try {
            return existing.toRealPath().resolve(existing.relativize(candidate)).normalize();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot resolve " + candidate, e);
        }
    }

    private SandboxViolationException outside(String pathSpec) {
        return new SandboxViolationException(pathSpec, SandboxViolationException.Kind.NOT_IN_SANDBOX,
                "Cannot access '" + pathSpec + "': path is outside sandbox.\nReadable paths: "
                        + String.join(", ", readableRoots()));
    }

    private SandboxViolationException escape(String pathSpec, String rootName) {
        return new SandboxViolationException(pathSpec, SandboxViolationException.Kind.PATH_ESCAPE,
                "Cannot access '" + pathSpec + "': path escapes sandbox root '" + rootName + "'.\nReadable paths: "
                        + String.join(", ", readableRoots()));
    }
}
