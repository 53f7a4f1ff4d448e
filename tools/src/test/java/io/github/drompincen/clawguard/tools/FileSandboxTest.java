package io.github.drompincen.clawguard.tools;

import io.github.drompincen.clawguard.protocol.api.SandboxRootConfig;
import io.github.drompincen.clawguard.runtime.errors.ConfigurationException;
import io.github.drompincen.clawguard.runtime.errors.SandboxViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSandboxTest {

    @TempDir
    Path tmp;

    private Path docs;
    private Path work;
    private FileSandbox sandbox;

    @BeforeEach
    void setUp() throws Exception {
        docs = Files.createDirectories(tmp.resolve("docs"));
        work = Files.createDirectories(tmp.resolve("work"));
        Files.writeString(docs.resolve("readme.md"), "hello sandbox");
        Files.createDirectories(docs.resolve("notes"));
        Files.writeString(docs.resolve("notes/a.txt"), "a");
        sandbox = new FileSandbox(List.of(
                SandboxRootConfig.readOnly("docs", docs.toString()),
                SandboxRootConfig.readWrite("work", work.toString())));
    }

    @Test
    void resolvesSlashAndColonForms() {
        assertThat(sandbox.resolve("docs/readme.md").display()).isEqualTo("docs/readme.md");
        assertThat(sandbox.resolve("docs:notes/a.txt").display()).isEqualTo("docs/notes/a.txt");
        assertThat(sandbox.resolve("docs/notes/../readme.md").relative()).isEqualTo("readme.md");
    }

    @Test
    void rejectsPathsOutsideAnyRoot() {
        assertThatThrownBy(() -> sandbox.resolve("/etc/passwd"))
                .isInstanceOfSatisfying(SandboxViolationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(SandboxViolationException.Kind.NOT_IN_SANDBOX))
                .hasMessageContaining("path is outside sandbox")
                .hasMessageContaining("Readable paths: docs/, work/");
        assertThatThrownBy(() -> sandbox.resolve("~/.ssh/id_rsa"))
                .isInstanceOf(SandboxViolationException.class);
        assertThatThrownBy(() -> sandbox.resolve("secrets/key"))
                .isInstanceOf(SandboxViolationException.class);
    }

    @Test
    void rejectsDotDotEscape() {
        assertThatThrownBy(() -> sandbox.resolve("docs/../work/x.txt"))
                .isInstanceOfSatisfying(SandboxViolationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(SandboxViolationException.Kind.PATH_ESCAPE));
        assertThatThrownBy(() -> sandbox.resolve("docs/../../outside.txt"))
                .isInstanceOf(SandboxViolationException.class)
                .hasMessageContaining("escapes sandbox root 'docs'");
    }

    @Test
    void rootItselfIsOnlyAcceptedWhereAllowed() {
        assertThatThrownBy(() -> sandbox.resolve("docs"))
                .isInstanceOf(SandboxViolationException.class);
        assertThat(sandbox.locate("docs", true).relative()).isEmpty();
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void rejectsSymlinkPointingOutOfRoot() throws Exception {
        Path outside = Files.createDirectories(tmp.resolve("outside"));
        Files.writeString(outside.resolve("secret.txt"), "secret");
        Files.createSymbolicLink(docs.resolve("link"), outside);

        assertThatThrownBy(() -> sandbox.read("docs/link/secret.txt"))
                .isInstanceOfSatisfying(SandboxViolationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(SandboxViolationException.Kind.PATH_ESCAPE));
        assertThat(sandbox.list("docs", null)).doesNotContain("docs/link/secret.txt");
    }

    @Test
    void readsInWindows() throws Exception {
        ReadResult full = sandbox.read("docs/readme.md");
        assertThat(full.content()).isEqualTo("hello sandbox");
        assertThat(full.truncated()).isFalse();

        ReadResult head = sandbox.read("docs/readme.md", 5, 0);
        assertThat(head.content()).isEqualTo("hello");
        assertThat(head.truncated()).isTrue();
        assertThat(head.totalChars()).isEqualTo(13);

        ReadResult tail = sandbox.read("docs/readme.md", 100, 6);
        assertThat(tail.content()).isEqualTo("sandbox");
        assertThat(tail.offset()).isEqualTo(6);
        assertThat(tail.truncated()).isFalse();

        assertThat(sandbox.read("docs/readme.md", 10, 500).content()).isEmpty();
    }

    @Test
    void adjacentWindowsConcatenateToTheLargerWindow() throws Exception {
        String text = "héllo wörld, ünïcödé ☃ and more";
        Files.writeString(docs.resolve("utf8.txt"), text);

        for (int n = 1; n <= text.length(); n++) {
            String first = sandbox.read("docs/utf8.txt", n, 0).content();
            String second = sandbox.read("docs/utf8.txt", 7, n).content();
            String whole = sandbox.read("docs/utf8.txt", n + 7, 0).content();
            assertThat(first + second).as("split at %d", n).isEqualTo(whole);
        }
        assertThat(sandbox.read("docs/utf8.txt", 5, 0).content() + sandbox.read("docs/utf8.txt", 100, 5).content())
                .isEqualTo(text);
    }

    @Test
    void writtenContentReadsBackThroughTheSandbox() throws Exception {
        String content = "line one\nline twö ☃\n";
        sandbox.write("work/roundtrip.txt", content);

        ReadResult back = sandbox.read("work/roundtrip.txt", content.length(), 0);
        assertThat(back.content()).isEqualTo(content);
        assertThat(back.truncated()).isFalse();
        assertThat(back.totalChars()).isEqualTo(content.length());
    }

    @Test
    void malformedPathsAreSandboxViolations() {
        assertThatThrownBy(() -> sandbox.resolve("docs/a\u0000b.txt"))
                .isInstanceOfSatisfying(SandboxViolationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(SandboxViolationException.Kind.NOT_IN_SANDBOX))
                .hasMessageContaining("invalid path");
        assertThatThrownBy(() -> sandbox.read("docs/a\u0000b.txt"))
                .isInstanceOf(SandboxViolationException.class);
    }

    @Test
    void enforcesSuffixesAndSizeCap() throws Exception {
        Path code = Files.createDirectories(tmp.resolve("code"));
        Files.writeString(code.resolve("Main.java"), "class Main {}");
        Files.writeString(code.resolve("blob.bin"), "xx");
        Files.writeString(code.resolve("Big.java"), "x".repeat(64));
        FileSandbox restricted = new FileSandbox(List.of(new SandboxRootConfig("code", code.toString(),
                SandboxRootConfig.Mode.RO, List.of(".java"), 32L, false, true)));

        assertThat(restricted.read("code/Main.java").content()).isEqualTo("class Main {}");
        assertThatThrownBy(() -> restricted.read("code/blob.bin"))
                .isInstanceOfSatisfying(SandboxViolationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(SandboxViolationException.Kind.SUFFIX_NOT_ALLOWED))
                .hasMessageContaining("suffix '.bin' not allowed");
        assertThatThrownBy(() -> restricted.read("code/Big.java"))
                .isInstanceOfSatisfying(SandboxViolationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(SandboxViolationException.Kind.TOO_LARGE));
    }

    @Test
    void writesOnlyToWritableRoots() throws Exception {
        assertThatThrownBy(() -> sandbox.write("docs/new.md", "x"))
                .isInstanceOfSatisfying(SandboxViolationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(SandboxViolationException.Kind.READ_ONLY))
                .hasMessageContaining("Writable paths: work/");
        assertThat(docs.resolve("new.md")).doesNotExist();

        String message = sandbox.write("work/out/report.txt", "done");
        assertThat(message).isEqualTo("Written 4 characters to work/out/report.txt");
        assertThat(Files.readString(work.resolve("out/report.txt"))).isEqualTo("done");
    }

    @Test
    void listsSortedAcrossRoots() throws Exception {
        Files.writeString(work.resolve("b.txt"), "b");

        assertThat(sandbox.list(".", null))
                .containsExactly("docs/notes/a.txt", "docs/readme.md", "work/b.txt");
        assertThat(sandbox.list("docs/notes", null)).containsExactly("docs/notes/a.txt");
        assertThat(sandbox.list("docs", "**/*.md")).containsExactly("docs/readme.md");
    }

    @Test
    void duplicateRootNamesAreRejected() {
        assertThatThrownBy(() -> new FileSandbox(List.of(
                SandboxRootConfig.readOnly("docs", docs.toString()),
                SandboxRootConfig.readOnly("docs", work.toString()))))
                .isInstanceOf(ConfigurationException.class);
    }
}
