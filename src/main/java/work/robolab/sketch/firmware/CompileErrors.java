package work.robolab.sketch.firmware;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.robolab.sketch.generator.SketchBundle;

/**
 * Maps compiler errors back to the blocks that produced the offending lines.
 */
public final class CompileErrors {
    private CompileErrors() {}

    /**
     * @return for each error, the ids of blocks emitting its line (empty when the line is framing)
     */
    public static Map<CompileError, List<String>> attribute(List<CompileError> errors, SketchBundle bundle) {
        var result = new LinkedHashMap<CompileError, List<String>>();
        for (var error : errors) {
            result.put(error, bundle.blocksAtLine(error.line()));
        }
        return result;
    }
}
