package io.github.drompincen.clawguard.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.clawguard.protocol.api.ShellDefault;
import io.github.drompincen.clawguard.protocol.api.ShellRule;
import io.github.drompincen.clawguard.runtime.actions.ActionProvider;
import io.github.drompincen.clawguard.runtime.actions.ActionProviderFactory;
import io.github.drompincen.clawguard.runtime.actions.ProviderBuildContext;
import io.github.drompincen.clawguard.runtime.errors.ConfigurationException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link ShellActionProvider} from {@code {"rules": [...], "default": {...}, "workingDirectory": "..."}}.
 * Rules with required roots use the filesystem provider declared earlier in the same task.
 */
public class ShellProviderFactory implements ActionProviderFactory {

    public static final String KIND = "shell";

    @Override public String kind() { return KIND; }

    @Override
    public ActionProvider create(JsonNode config, ProviderBuildContext context) {
        List<ShellRule> rules = new ArrayList<>();
        for (JsonNode node : config.path("rules")) {
            rules.add(parseRule(node));
        }
        ShellDefault fallback = config.hasNonNull("default")
                ? new ShellDefault(config.get("default").path("approvalRequired").asBoolean(true))
                : null;

        FileSandbox sandbox = context.find(SandboxActionProvider.class)
                .map(SandboxActionProvider::sandbox)
                .orElse(null);

        Path workingDirectory = null;
        if (config.hasNonNull("workingDirectory")) {
            String dir = config.get("workingDirectory").asText();
            workingDirectory = sandbox != null && sandbox.hasRoot(dir) ? sandbox.rootPath(dir) : Path.of(dir);
        }
        return new ShellActionProvider(new WhitelistExecutor(rules, fallback, sandbox, workingDirectory));
    }

    static ShellRule parseRule(JsonNode node) {
        List<String> roots = new ArrayList<>();
        node.path("requiredRoots").forEach(r -> roots.add(r.asText()));
        List<String> ifArgs = new ArrayList<>();
        node.path("approvalRequiredIfArgs").forEach(a -> ifArgs.add(a.asText()));
        try {
            return new ShellRule(node.path("pattern").asText(null), roots,
                    node.path("approvalRequired").asBoolean(true), ifArgs);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid shell rule " + node + ": " + e.getMessage(), e);
        }
    }
}
