package work.robolab.sketch.project;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.robolab.sketch.catalog.BlockCatalog;
import work.robolab.sketch.shared.JsonValues;

/**
 * Reads and writes {@code .robojson} project files.
 *
 * <p>Reading is lenient: nodes that are not objects or have no type, and edges missing an
 * endpoint, are skipped. Deprecated block ids are rewritten to their canonical ids; ids that are
 * neither known nor aliased pass through and surface later as unknown block types.
 */
public final class ProjectFiles {
    private static final Logger LOG = LoggerFactory.getLogger(ProjectFiles.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter JSON_WRITER = JSON.writerWithDefaultPrettyPrinter();

    private ProjectFiles() {}

    public static ProjectDocument read(Path path, BlockCatalog catalog) {
        return read(path, catalog.aliases());
    }

    public static ProjectDocument read(Path path, Map<String, String> aliases) {
        try {
            return fromTree(JSON.readTree(Files.readString(path, StandardCharsets.UTF_8)), aliases);
        } catch (IOException ex) {
            throw new ProjectFormatException("Unable to read project " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static ProjectDocument fromJson(String text, Map<String, String> aliases) {
        try {
            return fromTree(JSON.readTree(text), aliases);
        } catch (IOException ex) {
            throw new ProjectFormatException("Invalid project JSON: " + ex.getMessage(), ex);
        }
    }

    public static ProjectDocument fromTree(JsonNode root, Map<String, String> aliases) {
        if (root == null || !root.isObject()) {
            throw new ProjectFormatException("Project document must be an object");
        }
        var aliasMap = aliases == null ? Map.<String, String>of() : aliases;
        var nodes = new ArrayList<ProjectNode>();
        var nodesArray = root.get("nodes");
        if (nodesArray != null && nodesArray.isArray()) {
            for (var node : nodesArray) {
                if (!node.isObject()) continue;
                var type = JsonValues.text(node, "type");
                if (type == null) continue;
                var canonical = aliasMap.getOrDefault(type, type);
                if (!canonical.equals(type)) {
                    LOG.info("Block {} replaced by {} (compatibility)", type, canonical);
                }
                var uid = JsonValues.text(node, "uid");
                var pos = node.get("pos");
                var params = node.get("params");
                nodes.add(new ProjectNode(
                    uid == null ? type : uid,
                    canonical,
                    coordinate(pos, "x"),
                    coordinate(pos, "y"),
                    params != null && params.isObject() ? JsonValues.toMap(params) : Map.of()
                ));
            }
        }
        var edges = new ArrayList<ProjectEdge>();
        var edgesArray = root.get("edges");
        if (edgesArray != null && edgesArray.isArray()) {
            for (var edge : edgesArray) {
                if (!edge.isObject()) continue;
                var from = edge.get("from");
                var to = edge.get("to");
                var fromNode = JsonValues.text(from, "node");
                var toNode = JsonValues.text(to, "node");
                if (fromNode == null || toNode == null) continue;
                edges.add(new ProjectEdge(fromNode, JsonValues.text(from, "port"), toNode, JsonValues.text(to, "port")));
            }
        }
        var version = root.path("version").asInt(ProjectDocument.CURRENT_VERSION);
        return new ProjectDocument(version, JsonValues.text(root, "board"), JsonValues.text(root, "port"), nodes, edges);
    }

    public static void write(Path path, ProjectDocument document) {
        try {
            var parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, toJson(document), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ProjectFormatException("Unable to write project " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static String toJson(ProjectDocument document) {
        try {
            return JSON_WRITER.writeValueAsString(toSerializableMap(document)) + "\n";
        } catch (IOException ex) {
            throw new ProjectFormatException("Unable to serialize project: " + ex.getMessage(), ex);
        }
    }

    static Map<String, Object> toSerializableMap(ProjectDocument document) {
        var data = new LinkedHashMap<String, Object>();
        data.put("version", document.version());
        data.put("board", document.board());
        data.put("port", document.port());
        List<Map<String, Object>> nodes = new ArrayList<>();
        for (var node : document.nodes()) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("uid", node.uid());
            entry.put("type", node.type());
            entry.put("pos", Map.of("x", node.x(), "y", node.y()));
            entry.put("params", node.params());
            nodes.add(entry);
        }
        data.put("nodes", nodes);
        List<Map<String, Object>> edges = new ArrayList<>();
        for (var edge : document.edges()) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("uid", edge.key());
            entry.put("from", endpoint(edge.fromNode(), edge.fromPort()));
            entry.put("to", endpoint(edge.toNode(), edge.toPort()));
            edges.add(entry);
        }
        data.put("edges", edges);
        return data;
    }

    private static Map<String, Object> endpoint(String node, String port) {
        var endpoint = new LinkedHashMap<String, Object>();
        endpoint.put("node", node);
        endpoint.put("port", port);
        return endpoint;
    }

    private static double coordinate(JsonNode pos, String axis) {
        if (pos == null || !pos.isObject()) {
            return 0.0;
        }
        var value = pos.get(axis);
        return value != null && value.isNumber() ? value.asDouble() : 0.0;
    }
}
