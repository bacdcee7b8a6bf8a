package work.sdl2.canvas.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads workflow documents (local path or HTTP URL, JSON or YAML) into {@link Workflow} values.
 */
public final class WorkflowLoader {
    private static final Logger log = LoggerFactory.getLogger(WorkflowLoader.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_NAME = "Unnamed";

    private WorkflowLoader() {}

    public static Workflow loadFromLocalFile(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new WorkflowLoadException("Workflow file not found: " + path);
        }
        try (var in = Files.newInputStream(path)) {
            var workflow = parse(in, isYaml(path.getFileName().toString()));
            log.info("Loaded workflow '{}' from {}", workflow.name(), path);
            return workflow;
        } catch (IOException ex) {
            throw new WorkflowLoadException("Failed to read workflow: " + path, ex);
        }
    }

    public static Workflow loadFromHttp(URI uri) {
        try {
            var client = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build();
            var request = HttpRequest.newBuilder(uri).GET().build();
            var response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            if (response.statusCode() >= 400) {
                throw new WorkflowLoadException("HTTP " + response.statusCode() + " while downloading workflow: " + uri);
            }
            try (var body = response.body()) {
                var workflow = parse(body, isYaml(uri.getPath()));
                log.info("Loaded workflow '{}' from {}", workflow.name(), uri);
                return workflow;
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new WorkflowLoadException("Interrupted while downloading workflow: " + uri, ex);
        } catch (IOException ex) {
            throw new WorkflowLoadException("Failed to download workflow: " + uri, ex);
        }
    }

    public static Workflow parse(InputStream in, boolean yaml) throws IOException {
        var root = (yaml ? YAML_MAPPER : JSON_MAPPER).readTree(in);
        return fromTree(root);
    }

    public static Workflow parseJson(String json) {
        try {
            return fromTree(JSON_MAPPER.readTree(json));
        } catch (IOException ex) {
            throw new WorkflowLoadException("Invalid workflow JSON: " + ex.getMessage(), ex);
        }
    }

    static Workflow fromTree(JsonNode root) throws IOException {
        if (root == null || !root.isObject()) {
            throw new WorkflowLoadException("Workflow document must be an object");
        }
        var name = textOr(root.get("name"), DEFAULT_NAME);
        var description = textOr(root.get("description"), "");
        var operationsNode = root.get("operations");
        if (operationsNode == null || operationsNode.isNull()) {
            if (root.hasNonNull("type")) {
                return new Workflow(name, description, List.of(toSingleOperation(root)));
            }
            throw new WorkflowLoadException("Workflow document declares neither 'operations' nor 'type'");
        }
        if (!operationsNode.isArray()) {
            throw new WorkflowLoadException("'operations' must be an array");
        }
        var operations = new ArrayList<Operation>();
        int index = 0;
        for (var opNode : operationsNode) {
            operations.add(toOperation(opNode, index++));
        }
        return new Workflow(name, description, operations);
    }

    private static Operation toOperation(JsonNode node, int index) throws IOException {
        if (node == null || !node.isObject()) {
            throw new WorkflowLoadException("Operation #" + index + " must be an object: " + node);
        }
        var id = requireText(node, "id", index);
        var type = requireText(node, "type", index);
        return Operation.of(id, type, readParams(node, id));
    }

    /**
     * Single-operation document: top-level {@code type} and {@code params}. The id defaults to the type.
     */
    private static Operation toSingleOperation(JsonNode root) throws IOException {
        var type = requireText(root, "type", 0);
        var id = root.hasNonNull("id") ? requireText(root, "id", 0) : type;
        return Operation.of(id, type, readParams(root, id));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> readParams(JsonNode node, String id) throws IOException {
        var paramsNode = node.get("params");
        Map<String, Object> params = Map.of();
        if (paramsNode != null && !paramsNode.isNull()) {
            if (!paramsNode.isObject()) {
                throw new WorkflowLoadException("Operation " + id + " has non-object 'params'");
            }
            params = (Map<String, Object>) convertNode(paramsNode);
        }
        return params;
    }

    private static String requireText(JsonNode node, String field, int index) {
        var value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new WorkflowLoadException("Operation #" + index + " requires a non-empty '" + field + "'");
        }
        return value.asText();
    }

    private static String textOr(JsonNode node, String fallback) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        return node.asText();
    }

    private static Object convertNode(JsonNode node) throws IOException {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }

    private static boolean isYaml(String name) {
        if (name == null) {
            return false;
        }
        var lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yaml") || lower.endsWith(".yml");
    }
}
