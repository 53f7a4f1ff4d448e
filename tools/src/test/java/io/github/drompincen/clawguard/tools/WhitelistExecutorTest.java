package io.github.drompincen.clawguard.tools;

import io.github.drompincen.clawguard.protocol.api.SandboxRootConfig;
import io.github.drompincen.clawguard.protocol.api.ShellDefault;
import io.github.drompincen.clawguard.protocol.api.ShellRule;
import io.github.drompincen.clawguard.runtime.errors.ConfigurationException;
import io.github.drompincen.clawguard.runtime.errors.PolicyDeniedException;
import io.github.drompincen.clawguard.runtime.errors.WhitelistViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WhitelistExecutorTest {

    @TempDir
    Path tmp;

    private FileSandbox sandbox;

    @BeforeEach
    void setUp() throws Exception {
        Path repo = Files.createDirectories(tmp.resolve("repo"));
        Files.writeString(repo.resolve("build.log"), "ok");
        sandbox = new FileSandbox(List.of(SandboxRootConfig.readWrite("repo", repo.toString())));
    }

    private WhitelistExecutor executor(ShellDefault fallback, ShellRule... rules) {
        return new WhitelistExecutor(List.of(rules), fallback, sandbox, sandbox.rootPath("repo"));
    }

    @Test
    void metacharactersAreRefusedBeforeMatching() {
        WhitelistExecutor executor = executor(ShellDefault.requiringApproval(), ShellRule.preApproved("cat"));

        for (String command : List.of("cat a | sh", "cat a > b", "cat a; rm b", "cat a && rm b", "echo $(id)", "echo `id`")) {
            assertThatThrownBy(() -> executor.authorize(command))
                    .as(command)
                    .isInstanceOf(WhitelistViolationException.class)
                    .hasMessageContaining("blocked metacharacter");
        }
    }

    @Test
    void ruleMatchesWholeTokensOnly() {
        WhitelistExecutor executor = executor(null, ShellRule.preApproved("git status"));

        ShellAuthorization auth = executor.authorize("git status --short");
        assertThat(auth.viaDefault()).isFalse();
        assertThat(auth.approvalRequired()).isFalse();
        assertThat(auth.argv()).containsExactly("git", "status", "--short");

        assertThatThrownBy(() -> executor.authorize("gitx status"))
                .isInstanceOf(WhitelistViolationException.class)
                .hasMessageContaining("Command not in whitelist: gitx")
                .hasMessageContaining("Allowed patterns: git status");
        assertThatThrownBy(() -> executor.authorize("git push"))
                .isInstanceOf(PolicyDeniedException.class);
    }

    @Test
    void defaultAdmitsUnlistedCommands() {
        WhitelistExecutor executor = executor(ShellDefault.requiringApproval(), ShellRule.preApproved("ls"));

        ShellAuthorization auth = executor.authorize("make test");
        assertThat(auth.viaDefault()).isTrue();
        assertThat(auth.approvalRequired()).isTrue();
        assertThat(auth.capabilities().contains(ShellAuthorization.CAP_EXEC_UNLISTED)).isTrue();
    }

    @Test
    void pathArgumentsMustStayInRequiredRoots() {
        WhitelistExecutor executor = executor(null,
                new ShellRule("cat", List.of("repo"), false, List.of()));

        assertThat(executor.authorize("cat build.log").rule().pattern()).isEqualTo("cat");
        assertThat(executor.authorize("cat -n repo/build.log").argv()).contains("repo/build.log");

        assertThatThrownBy(() -> executor.authorize("cat ../../etc/passwd"))
                .isInstanceOf(WhitelistViolationException.class)
                .hasMessageContaining("outside allowed roots [repo]");
        assertThatThrownBy(() -> executor.authorize("cat /etc/passwd"))
                .isInstanceOf(WhitelistViolationException.class);
    }

    @Test
    void flaggedArgumentsForceApproval() {
        WhitelistExecutor executor = executor(null,
                new ShellRule("git", List.of(), false, List.of("push", "--force")));

        assertThat(executor.authorize("git log").approvalRequired()).isFalse();
        assertThat(executor.authorize("git push origin").approvalRequired()).isTrue();
    }

    @Test
    void unknownRequiredRootFailsAtConstruction() {
        assertThatThrownBy(() -> executor(null, new ShellRule("cat", List.of("nowhere"), false, List.of())))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("unknown sandbox root 'nowhere'");
        assertThatThrownBy(() -> new WhitelistExecutor(List.of(new ShellRule("cat", List.of("repo"), false, List.of())),
                null, null, null))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void emptyAndUnparseableCommandsAreRejected() {
        WhitelistExecutor executor = executor(ShellDefault.requiringApproval());

        assertThatThrownBy(() -> executor.authorize("   ")).hasMessage("Empty command");
        assertThatThrownBy(() -> executor.authorize("echo 'open"))
                .isInstanceOf(WhitelistViolationException.class)
                .hasMessageContaining("Cannot parse command");
    }

    @Test
    void timeoutIsClamped() {
        assertThat(WhitelistExecutor.clampTimeout(null)).isEqualTo(WhitelistExecutor.DEFAULT_TIMEOUT_SECONDS);
        assertThat(WhitelistExecutor.clampTimeout(0)).isEqualTo(1);
        assertThat(WhitelistExecutor.clampTimeout(10_000)).isEqualTo(WhitelistExecutor.MAX_TIMEOUT_SECONDS);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void runsCommandInWorkingDirectory() {
        WhitelistExecutor executor = executor(null, ShellRule.preApproved("ls"), ShellRule.preApproved("echo"));

        ShellResult echo = executor.execute("echo 'hello world'", null);
        assertThat(echo.exitCode()).isZero();
        assertThat(echo.stdout()).isEqualTo("hello world\n");
        assertThat(echo.truncated()).isFalse();

        assertThat(executor.execute("ls", 5).stdout()).contains("build.log");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void missingBinaryReportsNotFound() {
        WhitelistExecutor executor = executor(ShellDefault.requiringApproval());

        ShellResult result = executor.execute("definitely-not-a-real-binary-42", 5);
        assertThat(result.exitCode()).isEqualTo(ShellResult.EXIT_NOT_FOUND);
        assertThat(result.stderr()).contains("Command not found");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void largeOutputIsTruncated() {
        WhitelistExecutor executor = executor(null, ShellRule.preApproved("head"));

        ShellResult result = executor.execute("head -c 200000 /dev/zero", 10);
        assertThat(result.truncated()).isTrue();
        assertThat(result.stdout()).endsWith(WhitelistExecutor.TRUNCATION_MARKER);
        assertThat(result.stdout().length())
                .isEqualTo(WhitelistExecutor.MAX_OUTPUT_BYTES + WhitelistExecutor.TRUNCATION_MARKER.length());
    }
}
