package work.robolab.sketch.firmware;

import java.util.LinkedHashMap;
import java.util.Map;

public record CompileError(String file, int line, int column, String message) {
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("file", file);
        map.put("line", line);
        map.put("column", column);
        map.put("message", message);
        return map;
    }
}
