package work.robolab.sketch.project;

import java.util.List;

/**
 * Flat node/edge form of a project as the editor saves it ({@code .robojson}).
 * {@code board} and {@code port} may be {@code null}.
 */
public record ProjectDocument(int version, String board, String port, List<ProjectNode> nodes, List<ProjectEdge> edges) {
    public static final int CURRENT_VERSION = 1;

    public ProjectDocument {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }
}
