package com.impetus.impetus_backend.model.domain;

import java.util.Objects;

/**
 * Directed wire from an output port to an input port of the same graph.
 */
public record Edge(Port fromPort, Port toPort) {

    public Edge {
        Objects.requireNonNull(fromPort, "fromPort");
        Objects.requireNonNull(toPort, "toPort");
        if (!fromPort.isOutput()) {
            throw new IllegalArgumentException("Edge must start at an output port: " + fromPort);
        }
        if (!toPort.isInput()) {
            throw new IllegalArgumentException("Edge must end at an input port: " + toPort);
        }
    }

    public Node fromNode() {
        return fromPort.getOwner();
    }

    public Node toNode() {
        return toPort.getOwner();
    }

    public boolean touches(Node node) {
        return fromNode() == node || toNode() == node;
    }

    public boolean touches(Port port) {
        return fromPort == port || toPort == port;
    }
}
