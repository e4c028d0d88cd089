package work.robolab.sketch.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only registry of block definitions, palette entries and legacy id aliases.
 * Instances are immutable once built and safe to share across threads.
 */
public final class BlockCatalog {
    private final Map<String, BlockDefinition> definitions;
    private final Map<String, Category> categories;
    private final List<PaletteEntry> paletteEntries;
    private final Map<String, String> aliases;
    private final String entryBlockId;
    private final SourceFormat sourceFormat;

    public BlockCatalog(
        Collection<BlockDefinition> definitions,
        Map<String, Category> categories,
        List<PaletteEntry> paletteEntries,
        Map<String, String> aliases,
        String entryBlockId,
        SourceFormat sourceFormat
    ) {
        var byId = new LinkedHashMap<String, BlockDefinition>();
        for (BlockDefinition definition : definitions) {
            if (byId.putIfAbsent(definition.id(), definition) != null) {
                throw new IllegalArgumentException("Duplicate block id: " + definition.id());
            }
        }
        this.definitions = Collections.unmodifiableMap(byId);
        this.categories = categories == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(categories));
        this.paletteEntries = paletteEntries == null ? List.of() : List.copyOf(paletteEntries);
        this.aliases = aliases == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
        this.entryBlockId = entryBlockId == null ? defaultEntry(this.definitions) : entryBlockId;
        this.sourceFormat = sourceFormat == null ? SourceFormat.STRUCTURED : sourceFormat;
    }

    /**
     * Catalog holding only the built-in fallback definitions.
     */
    public static BlockCatalog defaults() {
        return new BlockCatalog(
            DefaultBlocks.definitions(),
            DefaultBlocks.categories(),
            List.of(),
            Map.of(),
            DefaultBlocks.START,
            SourceFormat.LIST
        );
    }

    public BlockDefinition get(String blockId) {
        var definition = blockId == null ? null : definitions.get(blockId);
        if (definition == null) {
            throw new UnknownBlockException(blockId);
        }
        return definition;
    }

    public Optional<BlockDefinition> find(String blockId) {
        return blockId == null ? Optional.empty() : Optional.ofNullable(definitions.get(blockId));
    }

    public boolean contains(String blockId) {
        return blockId != null && definitions.containsKey(blockId);
    }

    public Collection<BlockDefinition> definitions() {
        return definitions.values();
    }

    public Map<String, Category> categories() {
        return categories;
    }

    public List<PaletteEntry> paletteEntries() {
        return paletteEntries;
    }

    public Optional<PaletteEntry> paletteEntry(String blockId) {
        return paletteEntries.stream().filter(entry -> entry.id().equals(blockId)).findFirst();
    }

    public Map<String, String> aliases() {
        return aliases;
    }

    /**
     * Maps a deprecated block id to its canonical id; ids without an alias come back unchanged.
     */
    public String resolveAlias(String blockId) {
        if (blockId == null) {
            return null;
        }
        return aliases.getOrDefault(blockId, blockId);
    }

    /**
     * Definition id every program root is expected to reference.
     */
    public String entryBlockId() {
        return entryBlockId;
    }

    public SourceFormat sourceFormat() {
        return sourceFormat;
    }

    public boolean isDegraded() {
        return sourceFormat == SourceFormat.LIST;
    }

    private static String defaultEntry(Map<String, BlockDefinition> definitions) {
        if (definitions.containsKey(DefaultBlocks.START)) {
            return DefaultBlocks.START;
        }
        return definitions.values().stream()
            .filter(definition -> definition.kind() == BlockKind.EVENT)
            .map(BlockDefinition::id)
            .findFirst()
            .orElse(DefaultBlocks.START);
    }

    /**
     * Shape of the document the catalog was loaded from.
     */
    public enum SourceFormat {
        /** Palette-only list; generation runs on the built-in defaults. */
        LIST,
        /** Object with {@code blocks} and {@code categories}, carrying full generation metadata. */
        STRUCTURED
    }
}
