package io.github.drompincen.clawguard.tools;

import io.github.drompincen.clawguard.protocol.api.ShellDefault;
import io.github.drompincen.clawguard.protocol.api.ShellRule;
import io.github.drompincen.clawguard.runtime.errors.ConfigurationException;
import io.github.drompincen.clawguard.runtime.errors.SandboxViolationException;
import io.github.drompincen.clawguard.runtime.errors.WhitelistViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external commands that pass a whitelist. Commands are split into argv and started
 * directly, never through a shell, so metacharacters are refused up front.
 */
public class WhitelistExecutor {

    private static final Logger log = LoggerFactory.getLogger(WhitelistExecutor.class);

    public static final int DEFAULT_TIMEOUT_SECONDS = 30;
    public static final int MAX_TIMEOUT_SECONDS = 300;
    public static final int MAX_OUTPUT_BYTES = 50 * 1024;
    static final String TRUNCATION_MARKER = "\n... (output truncated)";
    static final List<String> BLOCKED_METACHARACTERS = List.of("|", ">", "<", ";", "&", "`", "$(", "${");

    private final List<ShellRule> rules;
    private final ShellDefault fallback;
    private final FileSandbox sandbox;
    private final Path workingDirectory;

    public WhitelistExecutor(List<ShellRule> rules, ShellDefault fallback, FileSandbox sandbox, Path workingDirectory) {
        this.rules = rules == null ? List.of() : List.copyOf(rules);
        this.fallback = fallback;
        this.sandbox = sandbox;
        this.workingDirectory = workingDirectory;
        for (ShellRule rule : this.rules) {
            if (rule.requiredRoots().isEmpty()) continue;
            if (sandbox == null) {
                throw new ConfigurationException("Shell rule '" + rule.pattern() + "' requires roots "
                        + rule.requiredRoots() + " but no file sandbox is configured");
            }
            for (String root : rule.requiredRoots()) {
                if (!sandbox.hasRoot(root)) {
                    throw new ConfigurationException("Shell rule '" + rule.pattern() + "' references unknown sandbox root '"
                            + root + "'. Known roots: " + sandbox.readableRoots());
                }
            }
        }
    }

    /**
     * Checks a command line against the whitelist without running it.
     *
     * @throws WhitelistViolationException if the command is malformed, uses a metacharacter,
     *         or matches no rule and there is no default
     */
    public ShellAuthorization authorize(String command) {
        if (command == null || command.isBlank()) {
            throw new WhitelistViolationException(command, "Empty command");
        }
        for (String meta : BLOCKED_METACHARACTERS) {
            if (command.contains(meta)) {
                throw new WhitelistViolationException(command, "Command contains blocked metacharacter '" + meta
                        + "': " + command + ". Pipes, redirects, chaining, background jobs and substitutions "
                        + "are not supported; run one command per call.");
            }
        }

        List<String> argv;
        try {
            argv = ShellTokenizer.tokenize(command);
        } catch (IllegalArgumentException e) {
            throw new WhitelistViolationException(command, "Cannot parse command '" + command + "': " + e.getMessage());
        }
        if (argv.isEmpty()) {
            throw new WhitelistViolationException(command, "Empty command");
        }

        String pathProblem = null;
        for (ShellRule rule : rules) {
            List<String> pattern = ShellTokenizer.tokenize(rule.pattern());
            if (!startsWith(argv, pattern)) continue;
            String problem = checkPaths(argv.subList(pattern.size(), argv.size()), rule.requiredRoots());
            if (problem != null) {
                if (pathProblem == null) pathProblem = problem;
                continue;
            }
            boolean approval = rule.approvalRequired()
                    || argv.stream().anyMatch(rule.approvalRequiredIfArgs()::contains);
            log.debug("Command {} matched rule '{}'", argv.get(0), rule.pattern());
            return new ShellAuthorization(argv, rule, approval);
        }

        if (fallback != null) {
            log.debug("Command {} admitted by default rule", argv.get(0));
            return new ShellAuthorization(argv, null, fallback.approvalRequired());
        }

        StringBuilder message = new StringBuilder("Command not in whitelist: ").append(argv.get(0));
        if (pathProblem != null) message.append(" (").append(pathProblem).append(')');
        List<String> patterns = rules.stream().map(ShellRule::pattern).toList();
        message.append(". Allowed patterns: ").append(patterns.isEmpty() ? "(none)" : String.join(", ", patterns));
        throw new WhitelistViolationException(command, message.toString());
    }

    public ShellResult execute(String command, Integer timeoutSeconds) {
        return run(authorize(command).argv(), timeoutSeconds);
    }

    ShellResult run(List<String> argv, Integer timeoutSeconds) {
        int timeout = clampTimeout(timeoutSeconds);
        ProcessBuilder pb = new ProcessBuilder(argv).redirectErrorStream(false);
        if (workingDirectory != null) pb.directory(workingDirectory.toFile());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            String message = String.valueOf(e.getMessage());
            if (message.contains("error=13") || message.contains("Permission denied")) {
                return new ShellResult("", "Permission denied: " + argv.get(0), ShellResult.EXIT_PERMISSION_DENIED, false);
            }
            log.debug("Failed to start {}: {}", argv.get(0), message);
            return new ShellResult("", "Command not found: " + argv.get(0), ShellResult.EXIT_NOT_FOUND, false);
        }

        CappedStreamReader stdout = new CappedStreamReader(process.getInputStream());
        CappedStreamReader stderr = new CappedStreamReader(process.getErrorStream());
        Thread stdoutThread = new Thread(stdout, "shell-stdout");
        Thread stderrThread = new Thread(stderr, "shell-stderr");
        stdoutThread.setDaemon(true);
        stderrThread.setDaemon(true);
        stdoutThread.start();
        stderrThread.start();

        try {
            boolean finished = process.waitFor(timeout, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                stdoutThread.join(1000);
                stderrThread.join(1000);
                log.warn("Command {} timed out after {}s", argv.get(0), timeout);
                return new ShellResult(stdout.text(), stderr.text() + "Command timed out after " + timeout + " seconds",
                        ShellResult.EXIT_TIMEOUT, stdout.truncated() || stderr.truncated());
            }
            stdoutThread.join(5000);
            stderrThread.join(5000);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return new ShellResult(stdout.text(), "Interrupted", ShellResult.EXIT_TIMEOUT, false);
        }

        boolean truncated = stdout.truncated() || stderr.truncated();
        String out = stdout.text() + (stdout.truncated() ? TRUNCATION_MARKER : "");
        String err = stderr.text() + (stderr.truncated() ? TRUNCATION_MARKER : "");
        log.debug("Command {} exited with {}", argv.get(0), process.exitValue());
        return new ShellResult(out, err, process.exitValue(), truncated);
    }

    static int clampTimeout(Integer requested) {
        int value = requested == null ? DEFAULT_TIMEOUT_SECONDS : requested;
        return Math.max(1, Math.min(MAX_TIMEOUT_SECONDS, value));
    }

    private static boolean startsWith(List<String> argv, List<String> pattern) {
        return !pattern.isEmpty() && argv.size() >= pattern.size() && argv.subList(0, pattern.size()).equals(pattern);
    }

    /** Returns a description of the first argument outside the required roots, or {@code null}. */
    private String checkPaths(List<String> args, List<String> requiredRoots) {
        if (requiredRoots.isEmpty()) return null;
        for (String arg : args) {
            if (arg.startsWith("-")) continue;
            if (!insideAnyRoot(arg, requiredRoots)) {
                return "path '" + arg + "' is outside allowed roots " + requiredRoots;
            }
        }
        return null;
    }

    private boolean insideAnyRoot(String arg, List<String> requiredRoots) {
        for (String root : requiredRoots) {
            String spec = arg.startsWith(root + "/") || arg.equals(root) ? arg : root + "/" + arg;
            try {
                sandbox.locate(spec, true);
                return true;
            } catch (SandboxViolationException e) {
                log.trace("{} not inside root {}: {}", arg, root, e.getMessage());
            }
        }
        return false;
    }

    /** Drains a stream to the end, keeping at most {@link #MAX_OUTPUT_BYTES}. */
    private static final class CappedStreamReader implements Runnable {

        private final InputStream in;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private volatile boolean truncated;

        CappedStreamReader(InputStream in) {
            this.in = in;
        }

        @Override
        public void run() {
            byte[] chunk = new byte[8192];
            try (InputStream stream = in) {
                int n;
                while ((n = stream.read(chunk)) != -1) {
                    synchronized (buffer) {
                        int room = MAX_OUTPUT_BYTES - buffer.size();
                        if (room > 0) buffer.write(chunk, 0, Math.min(room, n));
                        if (n > room) truncated = true;
                    }
                }
            } catch (IOException e) {
                log.debug("Output stream closed early: {}", e.getMessage());
            }
        }

        String text() {
            synchronized (buffer) {
                return buffer.toString(StandardCharsets.UTF_8);
            }
        }

        boolean truncated() {
            return truncated;
        }
    }
}
