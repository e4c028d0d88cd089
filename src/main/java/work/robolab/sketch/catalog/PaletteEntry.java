package work.robolab.sketch.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Palette-facing description of a block: what the editor shows and which values a freshly placed
 * block starts with. Independent from the generation metadata in {@link BlockDefinition}.
 */
public record PaletteEntry(
    String id,
    String category,
    String title,
    String section,
    String description,
    String color,
    List<Param> params,
    List<Port> inputs,
    List<Port> outputs,
    Map<String, Object> defaultParams,
    List<String> aliases
) {
    public PaletteEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        title = title == null || title.isBlank() ? id : title;
        params = params == null ? List.of() : List.copyOf(params);
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        defaultParams = defaultParams == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(defaultParams));
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    /**
     * Starting values for a new block: the catalog's {@code default_params} when present, otherwise
     * each declared parameter default, overlaid with {@code overrides}. Keys are always strings.
     */
    public Map<String, Object> initialValues(Map<?, ?> overrides) {
        var values = new LinkedHashMap<String, Object>();
        if (!defaultParams.isEmpty()) {
            values.putAll(defaultParams);
        } else {
            for (Param param : params) {
                values.put(param.name(), param.defaultValue());
            }
        }
        if (overrides != null) {
            for (Map.Entry<?, ?> entry : overrides.entrySet()) {
                values.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        }
        return values;
    }

    public record Param(String name, String type, Object defaultValue) {}

    public record Port(String name, String type) {}
}
