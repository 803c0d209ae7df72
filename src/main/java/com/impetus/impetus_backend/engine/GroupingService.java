package com.impetus.impetus_backend.engine;

import com.impetus.impetus_backend.config.CanvasProperties;
import com.impetus.impetus_backend.model.domain.Edge;
import com.impetus.impetus_backend.model.domain.Graph;
import com.impetus.impetus_backend.model.domain.Node;
import com.impetus.impetus_backend.model.domain.NodeType;
import com.impetus.impetus_backend.model.domain.Port;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a selection of nodes into a composite block.
 *
 * Edges crossing the selection boundary define the block's interface: every selected input
 * fed from outside becomes an input of the block, every selected output feeding something
 * outside becomes an output. The outer wires are re-attached to the block's ports and the
 * inner side is wired through proxy nodes, so the graph stays connected the same way as before.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GroupingService {

    private final ProxySynchronizer proxySynchronizer;
    private final CanvasProperties properties;

    /**
     * Groups {@code selection} (proxies and nodes outside {@code g} are ignored) into a new
     * composite node named {@code name}, appended to {@code g}.
     *
     * @return the composite, or empty when nothing groupable was selected
     */
    public Optional<Node> group(Graph g, Collection<Node> selection, String name) {
        Set<Node> selSet = Collections.newSetFromMap(new IdentityHashMap<>());
        selSet.addAll(selection);
        List<Node> sel = g.getNodes().stream()
                .filter(n -> selSet.contains(n) && !n.isProxy())
                .toList();
        if (sel.isEmpty()) return Optional.empty();
        selSet.retainAll(sel);

        String blockName = (name == null || name.isBlank())
                ? (sel.size() == 1 ? sel.get(0).getTitle() + "_grp" : "Group")
                : name.trim();

        // 1. Partition the edges touching the selection
        List<Edge> internal = new ArrayList<>();
        List<Edge> incoming = new ArrayList<>();
        List<Edge> outgoing = new ArrayList<>();
        for (Edge e : g.getEdges()) {
            boolean fromIn = selSet.contains(e.fromNode());
            boolean toIn = selSet.contains(e.toNode());
            if (fromIn && toIn) internal.add(e);
            else if (!fromIn && toIn) incoming.add(e);
            else if (fromIn) outgoing.add(e);
        }

        // 2. Boundary ports, top to bottom by owner
        List<Port> boundaryInputs = boundaryPorts(sel, incoming, true);
        List<Port> boundaryOutputs = boundaryPorts(sel, outgoing, false);

        // 3. The composite and its empty inner level
        NodeLayout.Box bb = NodeLayout.boundsOf(sel);
        double margin = properties.getGroupMargin();
        Node grp = new Node(blockName, bb.x() - margin, bb.y() - margin, NodeType.REGULAR);
        grp.setWidth(bb.width() + margin * 2);
        grp.setHeight(bb.height() + margin * 2);
        grp.setInner(new Graph(g, grp));
        Graph inner = grp.getInner();

        // 4. Interface ports
        Map<Port, Port> mapIn = new IdentityHashMap<>();
        Map<Port, Port> mapOut = new IdentityHashMap<>();
        for (Port p : boundaryInputs) {
            String proposed = p.getOwner().getTitle() + "." + p.getName();
            mapIn.put(p, grp.addInput(PortNaming.uniqueAmong(grp.getInputs(), proposed), p.getType()));
        }
        for (Port p : boundaryOutputs) {
            String proposed = p.getOwner().getTitle() + "." + p.getName();
            mapOut.put(p, grp.addOutput(PortNaming.uniqueAmong(grp.getOutputs(), proposed), p.getType()));
        }
        NodeLayout.autoSizeForPorts(grp, false);
        g.getNodes().add(grp);

        // 5. Move nodes in, take the affected edges out
        g.getNodes().removeAll(sel);
        inner.getNodes().addAll(sel);
        g.getEdges().removeAll(internal);
        g.getEdges().removeAll(incoming);
        g.getEdges().removeAll(outgoing);

        // 6. One proxy per interface port
        proxySynchronizer.synchronize(grp);

        // 7. Re-wire
        inner.getEdges().addAll(internal);
        for (Port p : boundaryInputs) {
            Port grpIn = mapIn.get(p);
            int idx = grpIn.index();
            for (Edge e : incoming) {
                if (e.toPort() == p) g.getEdges().add(new Edge(e.fromPort(), grpIn));
            }
            inner.getEdges().add(new Edge(proxyPort(inner, true, idx), p));
        }
        for (Port p : boundaryOutputs) {
            Port grpOut = mapOut.get(p);
            int idx = grpOut.index();
            inner.getEdges().add(new Edge(p, proxyPort(inner, false, idx)));
            for (Edge e : outgoing) {
                if (e.fromPort() == p) g.getEdges().add(new Edge(grpOut, e.toPort()));
            }
        }

        // 8. Cosmetic: center the moved nodes in the inner working area
        NodeLayout.placeInto(sel,
                NodeLayout.workingArea(g.getViewOffsetX(), g.getViewOffsetY(),
                        properties.getInnerViewportWidth(), properties.getInnerViewportHeight()),
                properties.getInnerPadding());

        log.info("Grouped {} node(s) into '{}' with {} input(s) and {} output(s)",
                sel.size(), blockName, boundaryInputs.size(), boundaryOutputs.size());
        return Optional.of(grp);
    }

    private static List<Port> boundaryPorts(List<Node> sel, List<Edge> crossing, boolean inputs) {
        Set<Port> crossingPorts = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Edge e : crossing) {
            crossingPorts.add(inputs ? e.toPort() : e.fromPort());
        }
        Set<Port> ordered = new LinkedHashSet<>();
        for (Node n : sel) {
            for (Port p : inputs ? n.getInputs() : n.getOutputs()) {
                if (crossingPorts.contains(p)) ordered.add(p);
            }
        }
        List<Port> result = new ArrayList<>(ordered);
        result.sort(Comparator.comparingDouble(p -> p.getOwner().getY()));
        return result;
    }

    private static Port proxyPort(Graph inner, boolean inlet, int index) {
        Node pn = inner.proxy(inlet, index)
                .orElseThrow(() -> new IllegalStateException("Missing " + (inlet ? "inlet" : "outlet") + " proxy " + index));
        return inlet ? pn.getOutputs().get(0) : pn.getInputs().get(0);
    }
}
