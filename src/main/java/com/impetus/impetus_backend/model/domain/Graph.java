package com.impetus.impetus_backend.model.domain;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * One level of the diagram hierarchy. The graph owns its nodes and edges; {@link #getParent()}
 * and {@link #getOwner()} are back-references used for navigation only (both null at the root).
 */
@Getter
public class Graph {

    private final List<Node> nodes = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final Graph parent;
    private final Node owner;

    // per-level panning offset
    @Setter
    private double viewOffsetX;
    @Setter
    private double viewOffsetY;

    public Graph(Graph parent, Node owner) {
        if ((parent == null) != (owner == null)) {
            throw new IllegalArgumentException("Parent and owner must both be set or both be null");
        }
        this.parent = parent;
        this.owner = owner;
    }

    public static Graph root() {
        return new Graph(null, null);
    }

    public boolean isRoot() {
        return owner == null;
    }

    public boolean contains(Node node) {
        return node != null && nodes.contains(node);
    }

    public Optional<Node> findNode(String id) {
        return nodes.stream().filter(n -> n.getId().equals(id)).findFirst();
    }

    public Optional<Edge> incomingEdge(Port input) {
        return edges.stream().filter(e -> e.toPort() == input).findFirst();
    }

    public List<Edge> edgesTouching(Port port) {
        return edges.stream().filter(e -> e.touches(port)).toList();
    }

    /** Removes every edge with {@code node} at either end; returns how many went. */
    public int removeEdgesTouching(Node node) {
        int before = edges.size();
        edges.removeIf(e -> e.touches(node));
        return before - edges.size();
    }

    public int removeEdgesTouching(Port port) {
        int before = edges.size();
        edges.removeIf(e -> e.touches(port));
        return before - edges.size();
    }

    /** Proxy nodes of one direction, ordered by proxy index. */
    public List<Node> proxies(boolean inlets) {
        return nodes.stream()
                .filter(n -> n.isProxy() && n.isProxyIsInlet() == inlets)
                .sorted(Comparator.comparingInt(Node::getProxyIndex))
                .toList();
    }

    public Optional<Node> proxy(boolean inlet, int index) {
        return nodes.stream()
                .filter(n -> n.isProxy() && n.isProxyIsInlet() == inlet && n.getProxyIndex() == index)
                .findFirst();
    }
}
