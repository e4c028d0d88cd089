package work.robolab.sketch.project;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.robolab.sketch.ast.BlockInstance;
import work.robolab.sketch.ast.Program;
import work.robolab.sketch.catalog.BlockCatalog;
import work.robolab.sketch.catalog.BlockKind;

/**
 * Converts between the editor's node/edge graph and the program AST.
 *
 * <p>A container edge {@code (A, container) -> (B, in)} nests B in A. A {@code next} edge chains B
 * after A inside A's own container. Edges out of an event on an undeclared port go to its
 * {@code loop} container.
 */
public final class ProgramGraphConverter {
    private static final Logger LOG = LoggerFactory.getLogger(ProgramGraphConverter.class);
    public static final String LAYOUT_KEY = "layout";
    public static final String UNPLACED_EDGES_KEY = "unplacedEdges";
    static final String LOOP_CONTAINER = "loop";
    private static final Set<String> SUCCESSOR_PORTS = Set.of(ProjectEdge.NEXT_PORT, "out");
    private static final int GRID_COLUMNS = 5;

    private final BlockCatalog catalog;

    public ProgramGraphConverter(BlockCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public Program toProgram(ProjectDocument document) {
        var program = new Program(document.board());
        var layout = new LinkedHashMap<String, Map<String, Double>>();
        for (var node : document.nodes()) {
            if (program.contains(node.uid())) {
                throw new ProjectFormatException("Duplicate node uid: " + node.uid());
            }
            program.add(new BlockInstance(node.uid(), node.type(), node.params()));
            layout.put(node.uid(), Map.of("x", node.x(), "y", node.y()));
        }
        program.metadata().put(LAYOUT_KEY, layout);

        var edges = new ArrayList<ProjectEdge>();
        var targets = new HashSet<String>();
        for (var edge : document.edges()) {
            if (!program.contains(edge.fromNode()) || !program.contains(edge.toNode())) {
                LOG.warn("Skipping edge {}: unknown node", edge.key());
                continue;
            }
            edges.add(edge);
            targets.add(edge.toNode());
        }

        var entryId = catalog.entryBlockId();
        for (var node : document.nodes()) {
            if (node.type().equals(entryId) && !targets.contains(node.uid())) {
                program.setRoot(node.uid());
                break;
            }
        }

        var successors = new ArrayList<ProjectEdge>();
        for (var edge : edges) {
            var container = containerFor(program.instance(edge.fromNode()), edge.fromPort());
            if (container == null) {
                successors.add(edge);
            } else {
                nest(program, edge, () -> program.attach(edge.fromNode(), container, edge.toNode()));
            }
        }
        placeSuccessors(program, successors);
        return program;
    }

    public ProjectDocument toDocument(Program program, String port) {
        var layout = layout(program);
        var ordered = new ArrayList<BlockInstance>();
        program.root().ifPresent(ordered::add);
        for (var instance : program.instances()) {
            if (!ordered.contains(instance)) {
                ordered.add(instance);
            }
        }

        var nodes = new ArrayList<ProjectNode>();
        var edges = new ArrayList<ProjectEdge>();
        for (int i = 0; i < ordered.size(); i++) {
            var instance = ordered.get(i);
            var position = layout.get(instance.id());
            double x = coordinate(position, "x", 40 + (i % GRID_COLUMNS) * 220);
            double y = coordinate(position, "y", 40 + (i / GRID_COLUMNS) * 140);
            nodes.add(new ProjectNode(instance.id(), instance.definitionId(), x, y, instance.values()));
            for (var container : instance.containerNames()) {
                String previous = null;
                for (var childId : instance.childIds(container)) {
                    edges.add(previous == null
                        ? new ProjectEdge(instance.id(), container, childId, ProjectEdge.INPUT_PORT)
                        : new ProjectEdge(previous, ProjectEdge.NEXT_PORT, childId, ProjectEdge.INPUT_PORT));
                    previous = childId;
                }
            }
        }
        edges.addAll(unplacedEdges(program));
        return new ProjectDocument(ProjectDocument.CURRENT_VERSION, program.boardId(), port, nodes, edges);
    }

    private String containerFor(BlockInstance source, String port) {
        var definition = catalog.find(source.definitionId());
        if (definition.isPresent() && definition.get().container(port).isPresent()) {
            return port;
        }
        if (definition.isPresent()
            && definition.get().kind() == BlockKind.EVENT
            && definition.get().container(LOOP_CONTAINER).isPresent()) {
            return LOOP_CONTAINER;
        }
        if (SUCCESSOR_PORTS.contains(port) || port.isEmpty()) {
            return null;
        }
        return port;
    }

    private void placeSuccessors(Program program, List<ProjectEdge> successors) {
        var pending = new ArrayList<>(successors);
        Map<String, Integer> placedAfter = new HashMap<>();
        boolean progress = true;
        while (progress && !pending.isEmpty()) {
            progress = false;
            var iterator = pending.iterator();
            while (iterator.hasNext()) {
                var edge = iterator.next();
                var parent = program.parentOf(edge.fromNode());
                if (parent.isEmpty()) continue;
                var container = program.containerOf(edge.fromNode()).orElseThrow();
                int index = parent.get().childIds(container).indexOf(edge.fromNode())
                    + 1 + placedAfter.getOrDefault(edge.fromNode(), 0);
                nest(program, edge, () -> program.insert(parent.get().id(), container, index, edge.toNode()));
                placedAfter.merge(edge.fromNode(), 1, Integer::sum);
                iterator.remove();
                progress = true;
            }
        }
        if (!pending.isEmpty()) {
            LOG.debug("{} edges left unplaced: their source is not nested in any container", pending.size());
            var unplaced = new ArrayList<Map<String, String>>();
            for (var edge : pending) {
                var entry = new LinkedHashMap<String, String>();
                entry.put("fromNode", edge.fromNode());
                entry.put("fromPort", edge.fromPort());
                entry.put("toNode", edge.toNode());
                entry.put("toPort", edge.toPort());
                unplaced.add(entry);
            }
            program.metadata().put(UNPLACED_EDGES_KEY, unplaced);
        }
    }

    private static void nest(Program program, ProjectEdge edge, Runnable action) {
        try {
            action.run();
        } catch (IllegalStateException ex) {
            throw new ProjectFormatException("Node " + edge.toNode() + " has more than one parent (edge " + edge.key() + ")", ex);
        } catch (IllegalArgumentException ex) {
            throw new ProjectFormatException("Edge " + edge.key() + " creates a cycle", ex);
        }
    }

    private static Map<?, ?> layout(Program program) {
        return program.metadata().get(LAYOUT_KEY) instanceof Map<?, ?> map ? map : Map.of();
    }

    /**
     * Reads one axis of a free-form layout entry; anything that is not a number falls back to the grid.
     */
    private static double coordinate(Object position, String axis, double fallback) {
        if (position instanceof Map<?, ?> map && map.get(axis) instanceof Number number) {
            return number.doubleValue();
        }
        return fallback;
    }

    private static List<ProjectEdge> unplacedEdges(Program program) {
        var edges = new ArrayList<ProjectEdge>();
        if (program.metadata().get(UNPLACED_EDGES_KEY) instanceof List<?> list) {
            for (var item : list) {
                if (item instanceof Map<?, ?> map) {
                    edges.add(new ProjectEdge(
                        String.valueOf(map.get("fromNode")),
                        (String) map.get("fromPort"),
                        String.valueOf(map.get("toNode")),
                        (String) map.get("toPort")
                    ));
                }
            }
        }
        return edges;
    }
}
