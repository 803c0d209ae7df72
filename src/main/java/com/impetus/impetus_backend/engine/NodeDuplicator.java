package com.impetus.impetus_backend.engine;

import com.impetus.impetus_backend.config.CanvasProperties;
import com.impetus.impetus_backend.model.domain.Edge;
import com.impetus.impetus_backend.model.domain.Graph;
import com.impetus.impetus_backend.model.domain.Node;
import com.impetus.impetus_backend.model.domain.Port;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Deep copies of nodes, including their nested inner graphs.
 *
 * Cloned edges are re-attached through an original-port to cloned-port map, so two ports
 * sharing a name on one node can never swap wires in the copy.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NodeDuplicator {

    private final ProxySynchronizer proxySynchronizer;
    private final CanvasProperties properties;

    /** Appends a copy of {@code src} to {@code g}, offset from the original, and returns it. */
    public Node duplicate(Graph g, Node src) {
        if (src.isProxy()) {
            throw new IllegalArgumentException("Proxy nodes cannot be duplicated: " + src);
        }
        double offset = properties.getDuplicateOffset();
        Node dup = copyNode(src, src.getTitle() + " Copy", new IdentityHashMap<>());
        dup.setX(src.getX() + offset);
        dup.setY(src.getY() + offset);

        if (src.getInner() != null) {
            dup.setInner(cloneGraph(src.getInner(), g, dup));
            proxySynchronizer.synchronize(dup);
        }

        g.getNodes().add(dup);
        log.debug("Duplicated {} as {}", src, dup);
        return dup;
    }

    /** Clones every node, edge and nested level of {@code src} into a new graph under {@code parent}/{@code owner}. */
    public Graph cloneGraph(Graph src, Graph parent, Node owner) {
        Graph g = new Graph(parent, owner);
        g.setViewOffsetX(src.getViewOffsetX());
        g.setViewOffsetY(src.getViewOffsetY());

        Map<Port, Port> portMap = new IdentityHashMap<>();
        Map<Node, Node> nodeMap = new IdentityHashMap<>();
        for (Node n : src.getNodes()) {
            Node cn = copyNode(n, n.getTitle(), portMap);
            if (n.isProxy()) {
                // proxies are addressed by their stable inlet_i / outlet_i ids
                cn.setId(n.getId());
                cn.setProxy(true);
                cn.setProxyIsInlet(n.isProxyIsInlet());
                cn.setProxyIndex(n.getProxyIndex());
            }
            g.getNodes().add(cn);
            nodeMap.put(n, cn);
        }

        for (Edge e : src.getEdges()) {
            Port fp = portMap.get(e.fromPort());
            Port tp = portMap.get(e.toPort());
            if (fp != null && tp != null) g.getEdges().add(new Edge(fp, tp));
        }

        for (Node n : src.getNodes()) {
            if (n.getInner() != null) {
                Node cn = nodeMap.get(n);
                cn.setInner(cloneGraph(n.getInner(), g, cn));
                proxySynchronizer.synchronize(cn);
            }
        }
        return g;
    }

    private static Node copyNode(Node n, String title, Map<Port, Port> portMap) {
        Node cn = new Node(title, n.getX(), n.getY(), n.getType());
        cn.setWidth(n.getWidth());
        cn.setHeight(n.getHeight());
        cn.setConstValue(n.getConstValue());
        cn.setMarshallerOutputType(n.getMarshallerOutputType());
        for (Port p : n.getInputs()) {
            Port cp = cn.addInput(p.getName(), p.getType());
            cp.setWidth(p.getWidth());
            portMap.put(p, cp);
        }
        for (Port p : n.getOutputs()) {
            Port cp = cn.addOutput(p.getName(), p.getType());
            cp.setWidth(p.getWidth());
            portMap.put(p, cp);
        }
        return cn;
    }
}
