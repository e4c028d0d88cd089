package work.robolab.sketch.project;

import java.util.Objects;

/**
 * Connection from an output port of one node to an input port of another.
 */
public record ProjectEdge(String fromNode, String fromPort, String toNode, String toPort) {
    public static final String INPUT_PORT = "in";
    public static final String NEXT_PORT = "next";

    public ProjectEdge {
        Objects.requireNonNull(fromNode, "fromNode");
        Objects.requireNonNull(toNode, "toNode");
        fromPort = fromPort == null ? "" : fromPort;
        toPort = toPort == null ? "" : toPort;
    }

    public String key() {
        return fromNode + ":" + fromPort + "->" + toNode + ":" + toPort;
    }
}
