package work.robolab.sketch.project;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Block placed on the editor canvas, as persisted in a project file.
 */
public record ProjectNode(String uid, String type, double x, double y, Map<String, Object> params) {
    public ProjectNode {
        Objects.requireNonNull(uid, "uid");
        Objects.requireNonNull(type, "type");
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }
}
