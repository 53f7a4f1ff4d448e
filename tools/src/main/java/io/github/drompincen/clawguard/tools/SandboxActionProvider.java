package io.github.drompincen.clawguard.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.clawguard.protocol.api.ActionDescriptor;
import io.github.drompincen.clawguard.protocol.api.ActionRequest;
import io.github.drompincen.clawguard.protocol.api.CapabilityRule;
import io.github.drompincen.clawguard.protocol.api.SandboxRootConfig;
import io.github.drompincen.clawguard.runtime.actions.ActionProvider;
import io.github.drompincen.clawguard.runtime.actions.ActionResult;
import io.github.drompincen.clawguard.runtime.call.CallContext;
import io.github.drompincen.clawguard.runtime.policy.CapabilitySet;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Set;

/**
 * read_file, write_file and list_files over a {@link FileSandbox}. Each root's approval toggles
 * are reported as suggested rules for {@code filesystem.read} and {@code filesystem.write}.
 */
public class SandboxActionProvider implements ActionProvider {

    public static final String READ = "read_file";
    public static final String WRITE = "write_file";
    public static final String LIST = "list_files";
    public static final String CAP_READ = "filesystem.read";
    public static final String CAP_WRITE = "filesystem.write";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final FileSandbox sandbox;

    public SandboxActionProvider(FileSandbox sandbox) {
        this.sandbox = sandbox;
    }

    public FileSandbox sandbox() {
        return sandbox;
    }

    @Override public String id() { return "filesystem"; }

    @Override
    public List<ActionDescriptor> actions() {
        return List.of(
                new ActionDescriptor(READ, "Read a text file from the sandbox. Paths look like root/relative/path.",
                        readSchema(), Set.of(CAP_READ)),
                new ActionDescriptor(WRITE, "Write a text file in a writable sandbox root, creating parent directories.",
                        writeSchema(), Set.of(CAP_WRITE)),
                new ActionDescriptor(LIST, "List files under a sandbox path; '.' lists every root.",
                        listSchema(), Set.of(CAP_READ)));
    }

    @Override
    public CapabilitySet capabilities(ActionRequest request) {
        switch (request.name()) {
            case READ: {
                SandboxRootConfig root = sandbox.rootConfig(sandbox.resolve(request.stringArg("path")).rootName());
                return CapabilitySet.suggesting(CAP_READ, rule(root.readApproval()));
            }
            case WRITE: {
                SandboxRootConfig root = sandbox.rootConfig(sandbox.checkWritable(request.stringArg("path")).rootName());
                return CapabilitySet.suggesting(CAP_WRITE, rule(root.writeApproval()));
            }
            case LIST: {
                String path = request.stringArg("path");
                boolean approval;
                if (path == null || path.isBlank() || ".".equals(path.trim())) {
                    approval = sandbox.roots().stream().anyMatch(SandboxRootConfig::readApproval);
                } else {
                    approval = sandbox.rootConfig(sandbox.locate(path, true).rootName()).readApproval();
                }
                return CapabilitySet.suggesting(CAP_READ, rule(approval));
            }
            default:
                return CapabilitySet.empty();
        }
    }

    @Override
    public String describe(ActionRequest request) {
        String path = request.stringArg("path");
        switch (request.name()) {
            case WRITE: {
                String content = request.stringArg("content");
                return "Write " + (content == null ? 0 : content.length()) + " chars to " + path;
            }
            case READ:
                return "Read " + path;
            case LIST:
                return "List " + (path == null ? "." : path);
            default:
                return ActionProvider.super.describe(request);
        }
    }

    @Override
    public ActionResult invoke(ActionRequest request, CallContext context) {
        JsonNode args = request.arguments();
        String path = request.stringArg("path");
        try {
            switch (request.name()) {
                case READ: {
                    int maxChars = args.path("max_chars").asInt(FileSandbox.DEFAULT_MAX_READ_CHARS);
                    int offset = args.path("offset").asInt(0);
                    ReadResult result = sandbox.read(path, maxChars, offset);
                    ObjectNode output = MAPPER.valueToTree(result);
                    output.put("path", sandbox.resolve(path).display());
                    return ActionResult.success(output);
                }
                case WRITE:
                    return ActionResult.success(TextNode.valueOf(sandbox.write(path, request.stringArg("content"))));
                case LIST: {
                    ArrayNode files = MAPPER.createArrayNode();
                    sandbox.list(path, request.stringArg("pattern")).forEach(files::add);
                    return ActionResult.success(files);
                }
                default:
                    return ActionResult.failure("Unsupported action: " + request.name());
            }
        } catch (IOException | UncheckedIOException e) {
            return ActionResult.failure("Failed to " + verb(request.name()) + " '" + path + "': " + e.getMessage());
        } catch (IllegalArgumentException e) {
            return ActionResult.failure(e.getMessage());
        }
    }

    private static CapabilityRule rule(boolean approvalRequired) {
        return approvalRequired ? CapabilityRule.NEEDS_APPROVAL : CapabilityRule.PRE_APPROVED;
    }

    private static String verb(String action) {
        return switch (action) {
            case READ -> "read";
            case WRITE -> "write";
            default -> "list";
        };
    }

    private static JsonNode readSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("path").put("type", "string").put("description", "File path as root/relative/path");
        props.putObject("max_chars").put("type", "integer").put("description", "Maximum characters to return (default 20000)");
        props.putObject("offset").put("type", "integer").put("description", "Character offset to start reading at (default 0)");
        schema.putArray("required").add("path");
        return schema;
    }

    private static JsonNode writeSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("path").put("type", "string").put("description", "File path as root/relative/path");
        props.putObject("content").put("type", "string").put("description", "Content to write");
        schema.putArray("required").add("path").add("content");
        return schema;
    }

    private static JsonNode listSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("path").put("type", "string").put("description", "Root or directory to list (default '.')");
        props.putObject("pattern").put("type", "string").put("description", "Glob pattern (default **/*)");
        return schema;
    }
}
