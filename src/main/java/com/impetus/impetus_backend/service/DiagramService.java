package com.impetus.impetus_backend.service;

import com.impetus.impetus_backend.codec.LayoutFormat;
import com.impetus.impetus_backend.codec.LayoutMapper;
import com.impetus.impetus_backend.engine.GroupingService;
import com.impetus.impetus_backend.engine.NodeDuplicator;
import com.impetus.impetus_backend.engine.NodeLayout;
import com.impetus.impetus_backend.engine.PortNaming;
import com.impetus.impetus_backend.engine.ProxySynchronizer;
import com.impetus.impetus_backend.exception.NodeNotFoundException;
import com.impetus.impetus_backend.model.domain.Edge;
import com.impetus.impetus_backend.model.domain.Graph;
import com.impetus.impetus_backend.model.domain.Node;
import com.impetus.impetus_backend.model.domain.NodeType;
import com.impetus.impetus_backend.model.domain.Port;
import com.impetus.impetus_backend.model.domain.PortSide;
import com.impetus.impetus_backend.model.domain.PortType;
import com.impetus.impetus_backend.model.domain.PortTypes;
import com.impetus.impetus_backend.model.dto.CanvasView;
import com.impetus.impetus_backend.model.dto.NodeDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The editing session: one diagram hierarchy, the level being edited and the current selection.
 *
 * Nodes are addressed by id within the active level. Every public operation runs to completion
 * under the service's monitor, so callers never observe a half-applied edit. Edits that would
 * break a model rule are refused with an {@link EditResult} instead of an exception.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiagramService {

    private final GroupingService groupingService;
    private final NodeDuplicator duplicator;
    private final ProxySynchronizer proxySynchronizer;
    private final LayoutStore layoutStore;
    private final LayoutMapper layoutMapper;

    private Graph root = Graph.root();
    private Graph current = root;
    private final List<Node> selection = new ArrayList<>();

    // ── Session state ──────────────────────────────────────────────────────────

    public synchronized Graph getRoot() {
        return root;
    }

    public synchronized Graph getCurrent() {
        return current;
    }

    public synchronized List<Node> getSelection() {
        return List.copyOf(selection);
    }

    /** Composite nodes from the root down to the active level; empty at the root. */
    public synchronized List<Node> getTrail() {
        List<Node> trail = new ArrayList<>();
        for (Graph g = current; !g.isRoot(); g = g.getParent()) {
            trail.add(g.getOwner());
        }
        Collections.reverse(trail);
        return trail;
    }

    public synchronized int getLevel() {
        return getTrail().size();
    }

    /** The active level as a document, with the trail leading to it and the selected ids. */
    public synchronized CanvasView view() {
        List<CanvasView.TrailEntry> trail = getTrail().stream()
                .map(n -> new CanvasView.TrailEntry(n.getId(), n.getTitle()))
                .toList();
        List<String> selected = selection.stream().map(Node::getId).toList();
        return new CanvasView(trail.size(), trail, selected, layoutMapper.toDto(current));
    }

    public synchronized NodeDto describe(Node n) {
        return layoutMapper.toDto(n);
    }

    public synchronized Node getNode(String nodeId) {
        return node(nodeId);
    }

    // ── Nodes ──────────────────────────────────────────────────────────────────

    public synchronized Node addNode(NodeType type, String title, double x, double y) {
        NodeType t = type != null ? type : NodeType.REGULAR;
        String name = title == null || title.isBlank() ? t.label() : title.trim();
        Node n = Node.withDefaultPorts(name, x, y, t);
        current.getNodes().add(n);
        log.debug("Added {}", n);
        return n;
    }

    public synchronized EditResult<Node> deleteNode(String nodeId) {
        Node n = node(nodeId);
        if (n.isPermanent()) return reject("Node '" + n.getTitle() + "' is permanent");
        if (n.isProxy()) return reject("Proxy nodes follow their composite's ports and cannot be deleted");

        int dropped = current.removeEdgesTouching(n);
        current.getNodes().remove(n);
        selection.remove(n);
        log.debug("Deleted {} and {} edge(s)", n, dropped);
        return EditResult.ok(n);
    }

    public synchronized EditResult<Node> renameNode(String nodeId, String title) {
        Node n = node(nodeId);
        if (n.isProxy()) return reject("Proxy nodes take their title from the mirrored port");
        n.setTitle(title != null ? title.trim() : "");
        return EditResult.ok(n);
    }

    public synchronized EditResult<Node> setConstValue(String nodeId, String value) {
        Node n = node(nodeId);
        if (n.getType() != NodeType.CONST) return reject("Only Const nodes carry a value");
        n.setConstValue(value != null ? value : Node.DEFAULT_CONST_VALUE);
        return EditResult.ok(n);
    }

    /**
     * Sets the title and the const value in one edit; either may be null to leave it alone.
     * Nothing is changed unless both parts are allowed.
     */
    public synchronized EditResult<Node> updateNode(String nodeId, String title, String constValue) {
        Node n = node(nodeId);
        if (title != null && n.isProxy()) return reject("Proxy nodes take their title from the mirrored port");
        if (constValue != null && n.getType() != NodeType.CONST) return reject("Only Const nodes carry a value");

        if (title != null) n.setTitle(title.trim());
        if (constValue != null) n.setConstValue(constValue);
        return EditResult.ok(n);
    }

    public synchronized EditResult<Node> duplicateNode(String nodeId) {
        Node src = node(nodeId);
        if (src.isProxy()) return reject("Proxy nodes cannot be duplicated");
        Node dup = duplicator.duplicate(current, src);
        setSelection(List.of(dup));
        return EditResult.ok(dup);
    }

    // ── Ports ──────────────────────────────────────────────────────────────────

    public synchronized EditResult<Port> addInputPort(String nodeId, String name, PortType type) {
        return addPort(nodeId, PortSide.INPUT, name, type);
    }

    public synchronized EditResult<Port> addOutputPort(String nodeId, String name, PortType type) {
        return addPort(nodeId, PortSide.OUTPUT, name, type);
    }

    public synchronized EditResult<Port> addPort(String nodeId, PortSide side, String name, PortType type) {
        Node n = node(nodeId);
        if (n.isProxy()) return reject("Ports of a proxy node cannot be edited");

        String base = name == null || name.isBlank() ? (side == PortSide.INPUT ? "In" : "Out") : name.trim();
        Port p = n.addPort(side, PortNaming.uniqueAmong(n.ports(side), base), type != null ? type : PortType.BIT);
        NodeLayout.autoSizeForPorts(n, false);
        proxySynchronizer.synchronize(n);
        return EditResult.ok(p);
    }

    public synchronized EditResult<Port> deletePort(String nodeId, PortSide side, String name) {
        Node n = node(nodeId);
        if (n.isProxy()) return reject("Ports of a proxy node cannot be edited");
        Port p = n.findPort(side, name);
        if (p == null) return reject("No " + side.label().toLowerCase() + " port '" + name + "' on '" + n.getTitle() + "'");

        int dropped = current.removeEdgesTouching(p);
        proxySynchronizer.releaseProxy(n, side == PortSide.INPUT, p.index());
        n.removePort(p);
        NodeLayout.autoSizeForPorts(n, true);
        proxySynchronizer.synchronize(n);
        log.debug("Deleted port {} and {} edge(s)", p, dropped);
        return EditResult.ok(p);
    }

    public synchronized EditResult<Port> renamePort(String nodeId, PortSide side, String name, String newName) {
        Node n = node(nodeId);
        if (n.isProxy()) return reject("Ports of a proxy node cannot be edited");
        Port p = n.findPort(side, name);
        if (p == null) return reject("No " + side.label().toLowerCase() + " port '" + name + "' on '" + n.getTitle() + "'");
        if (newName == null || newName.isBlank()) return reject("Port name must not be blank");
        if (PortNaming.isTaken(n.ports(side), newName.trim(), p)) {
            return reject("Port '" + newName.trim() + "' already exists on '" + n.getTitle() + "'");
        }

        p.setName(newName.trim());
        proxySynchronizer.synchronize(n);
        return EditResult.ok(p);
    }

    /** Changes a port's type; wires that no longer type-check are removed on both levels. */
    public synchronized EditResult<Port> retypePort(String nodeId, PortSide side, String name, PortType type) {
        Node n = node(nodeId);
        if (n.isProxy()) return reject("Ports of a proxy node cannot be edited");
        if (type == null) return reject("Port type is required");
        Port p = n.findPort(side, name);
        if (p == null) return reject("No " + side.label().toLowerCase() + " port '" + name + "' on '" + n.getTitle() + "'");

        p.setType(type);
        int pruned = pruneIncompatible(current, p);
        proxySynchronizer.synchronize(n);
        if (n.getInner() != null) {
            Optional<Node> proxy = n.getInner().proxy(side == PortSide.INPUT, p.index());
            if (proxy.isPresent()) {
                Node pn = proxy.get();
                Port mirror = pn.isProxyIsInlet() ? pn.getOutputs().get(0) : pn.getInputs().get(0);
                pruned += pruneIncompatible(n.getInner(), mirror);
            }
        }
        log.debug("Retyped {} ({} incompatible edge(s) removed)", p, pruned);
        return EditResult.ok(p);
    }

    /** Adds the next {@code OutN} to a Start node or {@code InN} to an End node. */
    public synchronized EditResult<Port> appendNextDefaultPort(String nodeId) {
        Node n = node(nodeId);
        Port p = n.appendNextDefaultPort();
        if (p == null) return reject(n.getType().label() + " nodes do not grow ports");
        NodeLayout.autoSizeForPorts(n, false);
        proxySynchronizer.synchronize(n);
        return EditResult.ok(p);
    }

    // ── Wires ──────────────────────────────────────────────────────────────────

    public synchronized EditResult<Edge> connect(String fromNodeId, String fromPort, String toNodeId, String toPort) {
        Node from = node(fromNodeId);
        Node to = node(toNodeId);
        Port out = from.findPort(PortSide.OUTPUT, fromPort);
        Port in = to.findPort(PortSide.INPUT, toPort);
        if (out == null) return reject("No output port '" + fromPort + "' on '" + from.getTitle() + "'");
        if (in == null) return reject("No input port '" + toPort + "' on '" + to.getTitle() + "'");
        return connect(out, in);
    }

    /**
     * Wires {@code out} to {@code in}. An existing wire into {@code in} from another output is
     * replaced; connecting the same pair again changes nothing.
     */
    public synchronized EditResult<Edge> connect(Port out, Port in) {
        if (!out.isOutput() || !in.isInput()) return reject("Wires run from an output to an input");
        if (!current.contains(out.getOwner()) || !current.contains(in.getOwner())) {
            return reject("Both nodes must be on the level being edited");
        }
        if (!PortTypes.compatible(out.getType(), in.getType())) {
            return reject("Type mismatch: " + out.getType() + " cannot feed " + in.getType());
        }

        Optional<Edge> existing = current.incomingEdge(in);
        if (existing.isPresent()) {
            if (existing.get().fromPort() == out) return EditResult.ok(existing.get());
            current.getEdges().remove(existing.get());
            log.debug("Replaced wire into {} from {}", in, existing.get().fromPort());
        }
        Edge e = new Edge(out, in);
        current.getEdges().add(e);
        return EditResult.ok(e);
    }

    public synchronized EditResult<Edge> disconnect(String fromNodeId, String fromPort, String toNodeId, String toPort) {
        Node from = node(fromNodeId);
        Node to = node(toNodeId);
        Optional<Edge> edge = current.getEdges().stream()
                .filter(e -> e.fromNode() == from && e.fromPort().getName().equals(fromPort)
                        && e.toNode() == to && e.toPort().getName().equals(toPort))
                .findFirst();
        if (edge.isEmpty()) return reject("No such wire");
        current.getEdges().remove(edge.get());
        return EditResult.ok(edge.get());
    }

    // ── Selection and composition ──────────────────────────────────────────────

    public synchronized List<Node> select(Collection<String> nodeIds) {
        List<Node> nodes = nodeIds.stream().map(this::node).toList();
        setSelection(nodes);
        return List.copyOf(selection);
    }

    private void setSelection(List<Node> nodes) {
        selection.clear();
        for (Node n : nodes) {
            if (!selection.contains(n)) selection.add(n);
        }
    }

    public synchronized EditResult<Node> groupSelection(String name) {
        Optional<Node> grp = groupingService.group(current, selection, name);
        if (grp.isEmpty()) return reject("Nothing to group: empty selection");
        setSelection(List.of(grp.get()));
        return EditResult.ok(grp.get());
    }

    /** Makes the composite's inner level the active one, creating an empty inner level if needed. */
    public synchronized EditResult<Graph> zoomInto(String nodeId) {
        Node n = node(nodeId);
        if (n.isProxy()) return reject("Proxy nodes have no inner level");
        if (n.getInner() == null) {
            n.setInner(new Graph(current, n));
        }
        proxySynchronizer.synchronize(n);
        current = n.getInner();
        selection.clear();
        log.debug("Zoomed into '{}' (level {})", n.getTitle(), getLevel());
        return EditResult.ok(current);
    }

    public synchronized EditResult<Graph> zoomOut() {
        if (current.isRoot()) return reject("Already at the top level");
        Node owner = current.getOwner();
        current = current.getParent();
        selection.clear();
        log.debug("Zoomed out of '{}' (level {})", owner.getTitle(), getLevel());
        return EditResult.ok(current);
    }

    // ── Documents ──────────────────────────────────────────────────────────────

    public synchronized void newGraph() {
        root = Graph.root();
        current = root;
        selection.clear();
        log.info("Started a new diagram");
    }

    /** With no explicit format, a {@code .json} or {@code .bcanvas} extension decides, then the configured default. */
    public synchronized void saveTo(Path path, LayoutFormat format) {
        layoutStore.save(root, path, format);
    }

    /** Replaces the whole hierarchy; on any failure the current diagram is left as it was. */
    public synchronized Graph loadFrom(Path path) {
        Graph loaded = layoutStore.load(path);
        root = loaded;
        current = loaded;
        selection.clear();
        return root;
    }

    /** Saves under the layout directory; {@code location} may not leave it. */
    public synchronized Path saveDocument(String location, LayoutFormat format) {
        Path path = layoutStore.resolveInLayoutDir(location);
        saveTo(path, format);
        return path;
    }

    /** Loads from the layout directory; {@code location} may not leave it. */
    public synchronized Path loadDocument(String location) {
        Path path = layoutStore.resolveInLayoutDir(location);
        loadFrom(path);
        return path;
    }

    // ── Helpers ────────────────────────────────────────────────────────────────

    private Node node(String nodeId) {
        return current.findNode(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
    }

    private static int pruneIncompatible(Graph g, Port port) {
        List<Edge> bad = g.edgesTouching(port).stream()
                .filter(e -> !PortTypes.compatible(e.fromPort().getType(), e.toPort().getType()))
                .toList();
        g.getEdges().removeAll(bad);
        return bad.size();
    }

    private static <T> EditResult<T> reject(String reason) {
        log.debug("Edit rejected: {}", reason);
        return EditResult.rejected(reason);
    }
}
