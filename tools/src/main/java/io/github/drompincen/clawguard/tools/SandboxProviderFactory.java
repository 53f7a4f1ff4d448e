package io.github.drompincen.clawguard.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.clawguard.protocol.api.SandboxRootConfig;
import io.github.drompincen.clawguard.runtime.actions.ActionProvider;
import io.github.drompincen.clawguard.runtime.actions.ActionProviderFactory;
import io.github.drompincen.clawguard.runtime.actions.ProviderBuildContext;
import io.github.drompincen.clawguard.runtime.errors.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds a {@link SandboxActionProvider} from
 * {@code {"roots": [{"name", "root", "mode", "suffixes", "maxFileBytes", "readApproval", "writeApproval"}]}}.
 */
public class SandboxProviderFactory implements ActionProviderFactory {

    public static final String KIND = "filesystem";

    @Override public String kind() { return KIND; }

    @Override
    public ActionProvider create(JsonNode config, ProviderBuildContext context) {
        JsonNode roots = config.path("roots");
        if (!roots.isArray() || roots.isEmpty()) {
            throw new ConfigurationException("filesystem provider in task '" + context.taskName() + "' needs a 'roots' list");
        }
        List<SandboxRootConfig> parsed = new ArrayList<>();
        for (JsonNode root : roots) {
            parsed.add(parseRoot(root));
        }
        return new SandboxActionProvider(new FileSandbox(parsed));
    }

    static SandboxRootConfig parseRoot(JsonNode node) {
        List<String> suffixes = null;
        if (node.hasNonNull("suffixes")) {
            suffixes = new ArrayList<>();
            for (JsonNode suffix : node.get("suffixes")) suffixes.add(suffix.asText());
        }
        Long maxFileBytes = node.hasNonNull("maxFileBytes") ? node.get("maxFileBytes").asLong() : null;
        String mode = node.path("mode").asText("ro").toUpperCase(Locale.ROOT);
        try {
            return new SandboxRootConfig(
                    node.path("name").asText(null),
                    node.path("root").asText(null),
                    SandboxRootConfig.Mode.valueOf(mode),
                    suffixes,
                    maxFileBytes,
                    node.path("readApproval").asBoolean(false),
                    node.path("writeApproval").asBoolean(true));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid sandbox root " + node + ": " + e.getMessage(), e);
        }
    }
}
