package work.robolab.sketch.generator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.robolab.sketch.catalog.Section;
import work.robolab.sketch.shared.Indentation;

/**
 * Generated sketch: the source text, the 1-based output lines each block instance contributed,
 * and the raw per-section line buffers.
 */
public record SketchBundle(String code, Map<String, List<Integer>> mapping, Map<Section, List<String>> sections) {
    public SketchBundle {
        var mappingCopy = new LinkedHashMap<String, List<Integer>>();
        mapping.forEach((block, lines) -> mappingCopy.put(block, List.copyOf(lines)));
        mapping = Collections.unmodifiableMap(mappingCopy);
        var sectionsCopy = new EnumMap<Section, List<String>>(Section.class);
        for (var section : Section.values()) {
            sectionsCopy.put(section, List.copyOf(sections.getOrDefault(section, List.of())));
        }
        sections = Collections.unmodifiableMap(sectionsCopy);
    }

    public List<Integer> linesOf(String blockId) {
        return mapping.getOrDefault(blockId, List.of());
    }

    /**
     * Block instances that produced output line {@code line}, in mapping order.
     */
    public List<String> blocksAtLine(int line) {
        var blocks = new ArrayList<String>();
        mapping.forEach((block, lines) -> {
            if (lines.contains(line)) {
                blocks.add(block);
            }
        });
        return blocks;
    }

    public List<String> sectionLines(Section section) {
        return sections.getOrDefault(section, List.of());
    }

    public List<String> lines() {
        return Indentation.lines(code);
    }
}
