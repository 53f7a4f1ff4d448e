package io.github.drompincen.clawguard.protocol.api;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SandboxRootConfigTest {

    @Test
    void readWriteFactoryDefaults() {
        SandboxRootConfig root = SandboxRootConfig.readWrite("out", "/tmp/out");

        assertThat(root.writable()).isTrue();
        assertThat(root.readApproval()).isFalse();
        assertThat(root.writeApproval()).isTrue();
        assertThat(root.suffixes()).isNull();
    }

    @Test
    void missingModeMeansReadOnly() {
        SandboxRootConfig root = new SandboxRootConfig("src", "/tmp/src", null, List.of(".md"), 10L, false, true);

        assertThat(root.writable()).isFalse();
        assertThat(root.suffixes()).containsExactly(".md");
    }

    @Test
    void rejectsNamesThatCollideWithPathSyntax() {
        assertThatThrownBy(() -> SandboxRootConfig.readOnly("a/b", "/tmp"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SandboxRootConfig.readOnly("a:b", "/tmp"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shellRuleDefaultsToEmptyLists() {
        ShellRule rule = new ShellRule("git status", null, false, null);

        assertThat(rule.requiredRoots()).isEmpty();
        assertThat(rule.approvalRequiredIfArgs()).isEmpty();
    }
}
