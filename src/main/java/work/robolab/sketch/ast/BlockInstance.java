package work.robolab.sketch.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A placed block: its id, the definition it instantiates, parameter values and, per container,
 * the ordered ids of its children. Child lists are only changed through {@link Program}, which
 * keeps the parent/child links consistent.
 */
public final class BlockInstance {
    private final String id;
    private final String definitionId;
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Map<String, List<String>> children = new LinkedHashMap<>();

    public BlockInstance(String id, String definitionId) {
        this(id, definitionId, Map.of());
    }

    public BlockInstance(String id, String definitionId, Map<String, ?> values) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Block instance id is required");
        }
        this.id = id;
        this.definitionId = Objects.requireNonNull(definitionId, "definitionId");
        if (values != null) {
            values.forEach(this::setValue);
        }
    }

    public String id() {
        return id;
    }

    public String definitionId() {
        return definitionId;
    }

    public Map<String, Object> values() {
        return Collections.unmodifiableMap(values);
    }

    public Object value(String name) {
        return values.get(name);
    }

    public boolean hasValue(String name) {
        return values.get(name) != null;
    }

    public BlockInstance setValue(String name, Object value) {
        Objects.requireNonNull(name, "name");
        if (value == null) {
            values.remove(name);
        } else {
            values.put(name, value);
        }
        return this;
    }

    public BlockInstance removeValue(String name) {
        values.remove(name);
        return this;
    }

    public Set<String> containerNames() {
        return Collections.unmodifiableSet(children.keySet());
    }

    public List<String> childIds(String container) {
        var ids = children.get(container);
        return ids == null ? List.of() : Collections.unmodifiableList(ids);
    }

    public boolean hasChildren() {
        return children.values().stream().anyMatch(ids -> !ids.isEmpty());
    }

    void insertChild(String container, int index, String childId) {
        var ids = children.computeIfAbsent(container, key -> new ArrayList<>());
        if (index < 0 || index > ids.size()) {
            ids.add(childId);
        } else {
            ids.add(index, childId);
        }
    }

    boolean removeChild(String childId) {
        for (var ids : children.values()) {
            if (ids.remove(childId)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Declares an empty container so that it survives persistence even without children.
     */
    void ensureContainer(String container) {
        children.computeIfAbsent(container, key -> new ArrayList<>());
    }

    @Override
    public String toString() {
        return "BlockInstance[" + id + ":" + definitionId + "]";
    }
}
