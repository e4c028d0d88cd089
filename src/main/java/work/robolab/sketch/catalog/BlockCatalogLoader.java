package work.robolab.sketch.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.robolab.sketch.shared.JsonValues;

/**
 * Loads block catalogs from JSON or YAML documents.
 *
 * <p>Two shapes are accepted. A top-level array is a palette-only list: malformed entries are skipped
 * and generation falls back to {@link DefaultBlocks}. An object with {@code blocks} and
 * {@code categories} is the authoritative form; any malformed block aborts the load with a
 * {@link CatalogLoadException} naming the block.
 */
public final class BlockCatalogLoader {
    private static final Logger LOG = LoggerFactory.getLogger(BlockCatalogLoader.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    public static final String BUNDLED_CATALOG = "/robolab/blocks.json";

    private BlockCatalogLoader() {}

    public static BlockCatalog load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new CatalogLoadException("Block catalog not found: " + path);
        }
        try (var in = Files.newInputStream(path)) {
            return fromTree(mapperFor(path.getFileName().toString()).readTree(in));
        } catch (IOException ex) {
            throw new CatalogLoadException("Invalid block catalog " + path + ": " + ex.getMessage(), ex);
        } catch (CatalogLoadException ex) {
            throw new CatalogLoadException("Invalid block catalog " + path + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Catalog bundled with the toolkit.
     */
    public static BlockCatalog bundled() {
        try (InputStream in = BlockCatalogLoader.class.getResourceAsStream(BUNDLED_CATALOG)) {
            if (in == null) {
                throw new CatalogLoadException("Bundled catalog missing: " + BUNDLED_CATALOG);
            }
            return fromTree(JSON.readTree(in));
        } catch (IOException ex) {
            throw new CatalogLoadException("Unable to read bundled catalog: " + ex.getMessage(), ex);
        }
    }

    public static BlockCatalog fromJson(String text) {
        try {
            return fromTree(JSON.readTree(text));
        } catch (IOException ex) {
            throw new CatalogLoadException("Invalid block catalog JSON: " + ex.getMessage(), ex);
        }
    }

    public static BlockCatalog fromTree(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw new CatalogLoadException("Block catalog document is empty");
        }
        if (root.isArray()) {
            return fromPaletteList(root);
        }
        if (root.isObject()) {
            return fromStructured(root);
        }
        throw new CatalogLoadException("Expected a list of blocks or an object with 'blocks'");
    }

    private static ObjectMapper mapperFor(String fileName) {
        var lower = fileName.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yaml") || lower.endsWith(".yml") ? YAML : JSON;
    }

    private static BlockCatalog fromPaletteList(JsonNode root) {
        var entries = new ArrayList<PaletteEntry>();
        var aliases = new LinkedHashMap<String, String>();
        var categories = new LinkedHashMap<>(DefaultBlocks.categories());
        int index = 0;
        for (var node : root) {
            index++;
            if (!node.isObject()) {
                LOG.warn("Skipping palette entry #{}: not an object", index);
                continue;
            }
            var id = JsonValues.text(node, "id");
            var category = JsonValues.text(node, "category");
            if (id == null || category == null) {
                LOG.warn("Skipping palette entry #{}: id and category are required", index);
                continue;
            }
            var paramsNode = node.has("params") ? node.get("params") : node.get("parameters");
            var color = JsonValues.text(node, "color");
            var entry = paletteEntry(node, id, category, paramsNode, color);
            entries.add(entry);
            categories.putIfAbsent(category, new Category(category, category, null));
            registerAliases(aliases, entry);
        }
        LOG.warn("Catalog carries palette data only; generation uses {} built-in blocks", DefaultBlocks.definitions().size());
        return new BlockCatalog(
            DefaultBlocks.definitions(),
            categories,
            entries,
            aliases,
            DefaultBlocks.START,
            BlockCatalog.SourceFormat.LIST
        );
    }

    private static BlockCatalog fromStructured(JsonNode root) {
        var blocksNode = root.get("blocks");
        if (blocksNode == null || !blocksNode.isArray()) {
            throw new CatalogLoadException("Catalog object has no 'blocks' array");
        }
        var categories = readCategories(root.get("categories"));
        var definitions = new ArrayList<BlockDefinition>();
        var entries = new ArrayList<PaletteEntry>();
        var aliases = new LinkedHashMap<String, String>();
        var seen = new LinkedHashMap<String, Integer>();
        int index = 0;
        for (var node : blocksNode) {
            index++;
            if (!node.isObject()) {
                throw new CatalogLoadException("Block #" + index + " is not an object");
            }
            var definition = readDefinition(node, index);
            var previous = seen.putIfAbsent(definition.id(), index);
            if (previous != null) {
                throw new CatalogLoadException("Block " + definition.id() + " is defined twice (#" + previous + " and #" + index + ")");
            }
            definitions.add(definition);
            var color = Optional.ofNullable(JsonValues.text(node, "color"))
                .orElseGet(() -> Optional.ofNullable(categories.get(definition.category())).map(Category::color).orElse(null));
            var entry = paletteEntry(node, definition.id(), definition.category(), node.get("parameters"), color);
            entries.add(entry);
            registerAliases(aliases, entry);
        }
        var entry = JsonValues.text(root, "entry");
        if (entry != null && !seen.containsKey(entry)) {
            throw new CatalogLoadException("Entry block " + entry + " is not defined in the catalog");
        }
        LOG.debug("Loaded {} block definitions in {} categories", definitions.size(), categories.size());
        try {
            return new BlockCatalog(definitions, categories, entries, aliases, entry, BlockCatalog.SourceFormat.STRUCTURED);
        } catch (IllegalArgumentException ex) {
            throw new CatalogLoadException(ex.getMessage(), ex);
        }
    }

    private static BlockDefinition readDefinition(JsonNode node, int index) {
        var id = JsonValues.text(node, "id");
        var label = id == null ? "#" + index : id;
        var name = JsonValues.text(node, "name");
        var category = JsonValues.text(node, "category");
        var kindRaw = JsonValues.text(node, "kind");
        if (id == null || name == null || category == null || kindRaw == null) {
            throw new CatalogLoadException("Block " + label + " is missing one of id, name, category, kind");
        }
        try {
            var builder = BlockDefinition.builder(id, BlockKind.from(kindRaw))
                .name(name)
                .category(category);
            var section = JsonValues.text(node, "section");
            if (section != null) {
                builder.section(Section.from(section));
            }
            var template = node.get("template");
            if (template != null && !template.isNull()) {
                if (!template.isTextual()) {
                    throw new CatalogLoadException("Block " + id + " has a non-text template");
                }
                builder.template(template.asText());
            }
            builder.returns(JsonValues.text(node, "returns"));
            readParameters(node.get("parameters"), id).forEach(param -> builder.parameter(param.name(), param.type(), param.defaultValue()));
            readContainers(node.get("containers"), id).forEach(builder::container);
            JsonValues.stringList(node.get("setup")).forEach(builder::setup);
            JsonValues.stringList(node.get("globals")).forEach(builder::global);
            JsonValues.stringList(node.get("includes")).forEach(builder::include);
            JsonValues.stringList(node.get("functions")).forEach(builder::function);
            return builder.build();
        } catch (IllegalArgumentException ex) {
            throw new CatalogLoadException("Block " + id + ": " + ex.getMessage(), ex);
        }
    }

    private static List<BlockParameter> readParameters(JsonNode node, String blockId) {
        var parameters = new ArrayList<BlockParameter>();
        if (node == null || node.isNull()) {
            return parameters;
        }
        if (!node.isArray()) {
            throw new CatalogLoadException("Block " + blockId + " has malformed parameters: expected a list");
        }
        for (var item : node) {
            var name = JsonValues.text(item, "name");
            var type = JsonValues.text(item, "type");
            if (!item.isObject() || name == null || type == null) {
                throw new CatalogLoadException("Block " + blockId + " has a malformed parameter: " + item);
            }
            parameters.add(new BlockParameter(name, type, JsonValues.toJava(item.get("default"))));
        }
        return parameters;
    }

    private static List<BlockContainerSpec> readContainers(JsonNode node, String blockId) {
        var containers = new ArrayList<BlockContainerSpec>();
        if (node == null || node.isNull()) {
            return containers;
        }
        if (!node.isArray()) {
            throw new CatalogLoadException("Block " + blockId + " has malformed containers: expected a list");
        }
        for (var item : node) {
            var name = JsonValues.text(item, "name");
            var section = JsonValues.text(item, "section");
            if (!item.isObject() || name == null || section == null) {
                throw new CatalogLoadException("Block " + blockId + " has a malformed container: " + item);
            }
            try {
                containers.add(BlockContainerSpec.withPlaceholder(name, Section.from(section), JsonValues.text(item, "placeholder")));
            } catch (IllegalArgumentException ex) {
                throw new CatalogLoadException("Block " + blockId + " container " + name + ": " + ex.getMessage(), ex);
            }
        }
        return containers;
    }

    private static Map<String, Category> readCategories(JsonNode node) {
        var categories = new LinkedHashMap<String, Category>();
        if (node == null || !node.isObject()) {
            return categories;
        }
        var fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            var value = entry.getValue();
            categories.put(entry.getKey(), new Category(
                entry.getKey(),
                Optional.ofNullable(JsonValues.text(value, "title")).orElse(entry.getKey()),
                JsonValues.text(value, "color")
            ));
        }
        return categories;
    }

    private static PaletteEntry paletteEntry(JsonNode node, String id, String category, JsonNode paramsNode, String color) {
        var title = Optional.ofNullable(JsonValues.text(node, "title"))
            .or(() -> Optional.ofNullable(JsonValues.text(node, "name")))
            .orElse(id);
        var ports = node.get("ports");
        var defaults = node.get("default_params");
        return new PaletteEntry(
            id,
            category,
            title,
            JsonValues.text(node, "section"),
            JsonValues.text(node, "description"),
            color,
            paletteParams(paramsNode),
            ports(ports == null ? null : ports.get("inputs")),
            ports(ports == null ? null : ports.get("outputs")),
            defaults != null && defaults.isObject() ? JsonValues.toMap(defaults) : Map.of(),
            aliasList(node.get("aliases"))
        );
    }

    private static List<PaletteEntry.Param> paletteParams(JsonNode node) {
        var params = new ArrayList<PaletteEntry.Param>();
        if (node == null || !node.isArray()) {
            return params;
        }
        for (var item : node) {
            var name = JsonValues.text(item, "name");
            if (!item.isObject() || name == null) {
                continue;
            }
            params.add(new PaletteEntry.Param(name, JsonValues.text(item, "type"), JsonValues.toJava(item.get("default"))));
        }
        return params;
    }

    private static List<PaletteEntry.Port> ports(JsonNode node) {
        var ports = new ArrayList<PaletteEntry.Port>();
        if (node == null || !node.isArray()) {
            return ports;
        }
        for (var item : node) {
            var name = JsonValues.text(item, "name");
            if (item.isObject() && name != null) {
                ports.add(new PaletteEntry.Port(name, JsonValues.text(item, "type")));
            }
        }
        return ports;
    }

    private static List<String> aliasList(JsonNode node) {
        var aliases = new ArrayList<String>();
        for (var alias : JsonValues.stringList(node)) {
            var trimmed = alias.trim();
            if (!trimmed.isEmpty()) {
                aliases.add(trimmed);
            }
        }
        return aliases;
    }

    private static void registerAliases(Map<String, String> aliases, PaletteEntry entry) {
        for (var alias : entry.aliases()) {
            aliases.putIfAbsent(alias, entry.id());
        }
    }
}
