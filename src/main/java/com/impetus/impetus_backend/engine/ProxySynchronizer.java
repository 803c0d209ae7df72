package com.impetus.impetus_backend.engine;

import com.impetus.impetus_backend.model.domain.Graph;
import com.impetus.impetus_backend.model.domain.Node;
import com.impetus.impetus_backend.model.domain.Port;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps the proxy nodes inside a composite block's inner graph in step with the block's
 * own port lists.
 *
 * After {@link #synchronize(Node)} the inner graph holds exactly one inlet proxy per input
 * (proxy index 0..n-1) and one outlet proxy per output, and every proxy's single port carries
 * the name and type of the port it stands for. Edges are only touched when the proxy they
 * hang on is removed. Running it again without changing the owner's ports does nothing.
 */
@Slf4j
@Component
public class ProxySynchronizer {

    /**
     * @return true if the inner graph was changed
     */
    public boolean synchronize(Node owner) {
        Graph inner = owner.getInner();
        if (inner == null || owner.isProxy()) return false;

        boolean changed = syncSide(owner, inner, true);
        changed |= syncSide(owner, inner, false);
        return changed;
    }

    /** Synchronizes every composite node below (and including) the nodes of {@code graph}. */
    public void synchronizeTree(Graph graph) {
        for (Node n : List.copyOf(graph.getNodes())) {
            if (n.getInner() != null && !n.isProxy()) {
                synchronize(n);
                synchronizeTree(n.getInner());
            }
        }
    }

    /**
     * Called before the owner's port at {@code index} is removed: drops that port's proxy with
     * its wires and shifts the later proxies down one index, so inner wires stay attached to
     * the ports they belonged to.
     */
    public void releaseProxy(Node owner, boolean inlet, int index) {
        Graph inner = owner.getInner();
        if (inner == null || owner.isProxy()) return;

        inner.proxy(inlet, index).ifPresent(pn -> {
            int dropped = inner.removeEdgesTouching(pn);
            inner.getNodes().remove(pn);
            log.debug("Released {} of '{}' ({} edge(s) dropped)", pn, owner.getTitle(), dropped);
        });
        String prefix = inlet ? "inlet_" : "outlet_";
        for (Node pn : inner.proxies(inlet)) {
            int idx = pn.getProxyIndex();
            if (idx <= index) continue;
            pn.setProxyIndex(idx - 1);
            if (pn.getId().equals(prefix + idx) && inner.findNode(prefix + (idx - 1)).isEmpty()) {
                pn.setId(prefix + (idx - 1));
            }
        }
    }

    private boolean syncSide(Node owner, Graph inner, boolean inlets) {
        List<Port> ports = inlets ? owner.getInputs() : owner.getOutputs();
        int n = ports.size();
        boolean changed = false;

        // Surplus proxies: index past the port list, a repeated index, or a malformed proxy
        Set<Integer> seen = new HashSet<>();
        for (Node pn : inner.proxies(inlets)) {
            int idx = pn.getProxyIndex();
            if (idx < 0 || idx >= n || mirrorPort(pn) == null || !seen.add(idx)) {
                int dropped = inner.removeEdgesTouching(pn);
                inner.getNodes().remove(pn);
                changed = true;
                log.debug("Removed {} of '{}' ({} edge(s) dropped)", pn, owner.getTitle(), dropped);
            }
        }

        for (int i = 0; i < n; i++) {
            Port parentPort = ports.get(i);
            Optional<Node> existing = inner.proxy(inlets, i);
            if (existing.isPresent()) {
                changed |= restamp(existing.get(), parentPort);
            } else {
                Node pn = Node.proxyFor(parentPort, inlets, i);
                if (inner.findNode(pn.getId()).isPresent()) {
                    pn.setId(pn.getId() + "_" + Node.newId().substring(0, 8));
                }
                inner.getNodes().add(pn);
                changed = true;
                log.debug("Created {} for '{}'", pn, owner.getTitle());
            }
        }
        return changed;
    }

    private static boolean restamp(Node pn, Port parentPort) {
        Port mirror = mirrorPort(pn);
        boolean changed = false;
        if (!Objects.equals(pn.getTitle(), parentPort.getName())) {
            pn.setTitle(parentPort.getName());
            changed = true;
        }
        if (!mirror.getName().equals(parentPort.getName())) {
            mirror.setName(parentPort.getName());
            changed = true;
        }
        if (!mirror.getType().equals(parentPort.getType())) {
            mirror.setType(parentPort.getType());
            changed = true;
        }
        return changed;
    }

    /** The single port of a well-formed proxy, or null. */
    static Port mirrorPort(Node pn) {
        List<Port> ports = pn.isProxyIsInlet() ? pn.getOutputs() : pn.getInputs();
        List<Port> others = pn.isProxyIsInlet() ? pn.getInputs() : pn.getOutputs();
        return ports.size() == 1 && others.isEmpty() ? ports.get(0) : null;
    }
}
