package com.impetus.impetus_backend.codec;

import com.impetus.impetus_backend.engine.ProxySynchronizer;
import com.impetus.impetus_backend.exception.LayoutFormatException;
import com.impetus.impetus_backend.model.domain.Edge;
import com.impetus.impetus_backend.model.domain.Graph;
import com.impetus.impetus_backend.model.domain.Node;
import com.impetus.impetus_backend.model.domain.NodeType;
import com.impetus.impetus_backend.model.domain.Port;
import com.impetus.impetus_backend.model.domain.PortSide;
import com.impetus.impetus_backend.model.domain.PortType;
import com.impetus.impetus_backend.model.dto.EdgeDto;
import com.impetus.impetus_backend.model.dto.LayoutDto;
import com.impetus.impetus_backend.model.dto.LayoutGraphDto;
import com.impetus.impetus_backend.model.dto.NodeDto;
import com.impetus.impetus_backend.model.dto.PortDefDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between the live {@link Graph} tree and the format-neutral {@link LayoutDto} tree.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LayoutMapper {

    private static final String FORMAT = "layout";

    private final ProxySynchronizer proxySynchronizer;

    public LayoutDto toDto(Graph root, int version) {
        return new LayoutDto(version, toDto(root));
    }

    public LayoutGraphDto toDto(Graph g) {
        List<NodeDto> nodes = g.getNodes().stream().map(this::toDto).toList();
        List<EdgeDto> edges = g.getEdges().stream()
                .map(e -> EdgeDto.of(e.fromNode().getId(), e.fromPort().getName(), e.toNode().getId(), e.toPort().getName()))
                .toList();
        return new LayoutGraphDto(nodes, edges, g.getViewOffsetX(), g.getViewOffsetY());
    }

    public NodeDto toDto(Node n) {
        return NodeDto.builder()
                .id(n.getId())
                .title(n.getTitle())
                .x(n.getX())
                .y(n.getY())
                .w(n.getWidth())
                .h(n.getHeight())
                .isProxy(n.isProxy())
                .proxyIsInlet(n.isProxyIsInlet())
                .proxyIndex(n.getProxyIndex())
                .type(n.getType().label())
                .isPermanent(n.isPermanent())
                .constValue(n.getConstValue())
                .marshallerOutputType(n.getMarshallerOutputType() == null || n.getMarshallerOutputType().isEmpty()
                        ? null : n.getMarshallerOutputType())
                .inputs(n.getInputs().stream().map(LayoutMapper::toPortDef).toList())
                .outputs(n.getOutputs().stream().map(LayoutMapper::toPortDef).toList())
                .inner(n.getInner() != null ? toDto(n.getInner()) : null)
                .build();
    }

    /**
     * Builds a fresh root graph from {@code layout}. Wires whose node or port cannot be
     * resolved are dropped, as are wires into an input that is already fed. Proxy nodes of
     * every composite are re-synchronized with their owner's ports afterwards.
     */
    public Graph toGraph(LayoutDto layout) {
        Graph root = toGraph(layout.graph(), null, null);
        proxySynchronizer.synchronizeTree(root);
        return root;
    }

    private Graph toGraph(LayoutGraphDto dto, Graph parent, Node owner) {
        Graph g = new Graph(parent, owner);
        g.setViewOffsetX(dto.vx());
        g.setViewOffsetY(dto.vy());
        Map<String, Node> idMap = new HashMap<>();

        for (NodeDto nDto : dto.nodes()) {
            if (nDto == null) {
                throw new LayoutFormatException(FORMAT, "Null block entry in graph");
            }
            NodeType type = NodeType.fromLabel(nDto.type());
            Node n = new Node(nDto.title(), nDto.x(), nDto.y(), type);
            if (!nDto.id().isBlank()) {
                n.setId(nDto.id());
            }
            if (idMap.containsKey(n.getId())) {
                log.warn("Duplicate node id '{}' in layout; assigning a fresh id", n.getId());
                n.setId(Node.newId());
            }
            n.setProxy(nDto.isProxy());
            n.setProxyIsInlet(nDto.proxyIsInlet());
            n.setProxyIndex(nDto.proxyIndex());
            n.setPermanent(nDto.isPermanent());
            n.setConstValue(nDto.constValue());
            n.setMarshallerOutputType(nDto.marshallerOutputType());
            n.setWidth(nDto.w() <= 0 ? type.defaultWidth() : nDto.w());
            n.setHeight(nDto.h() <= 0 ? type.defaultHeight() : nDto.h());

            for (PortDefDto def : nDto.inputs()) {
                n.addInput(portName(def, n), toPortType(def)).setWidth(def.width());
            }
            for (PortDefDto def : nDto.outputs()) {
                n.addOutput(portName(def, n), toPortType(def)).setWidth(def.width());
            }

            g.getNodes().add(n);
            idMap.put(n.getId(), n);

            if (nDto.inner() != null) {
                if (n.isProxy()) {
                    log.debug("Ignoring inner graph of proxy node {}", n);
                } else {
                    n.setInner(toGraph(nDto.inner(), g, n));
                }
            }
        }

        for (EdgeDto eDto : dto.edges()) {
            Edge edge = resolve(eDto, idMap);
            if (edge == null) {
                log.debug("Dropping unresolved wire {}", eDto);
                continue;
            }
            if (g.incomingEdge(edge.toPort()).isPresent()) {
                log.debug("Dropping second wire into input {}", edge.toPort());
                continue;
            }
            g.getEdges().add(edge);
        }
        return g;
    }

    private static Edge resolve(EdgeDto eDto, Map<String, Node> idMap) {
        if (eDto == null || eDto.from() == null || eDto.to() == null) return null;
        Node fromNode = idMap.get(eDto.from().nodeId());
        Node toNode = idMap.get(eDto.to().nodeId());
        if (fromNode == null || toNode == null) return null;

        Port fromPort = fromNode.findPort(PortSide.OUTPUT, eDto.from().port());
        Port toPort = toNode.findPort(PortSide.INPUT, eDto.to().port());
        if (fromPort == null || toPort == null) return null;
        return new Edge(fromPort, toPort);
    }

    private static String portName(PortDefDto def, Node n) {
        if (def == null) {
            throw new LayoutFormatException(FORMAT, "Null port entry on block '" + n.getId() + "'");
        }
        return def.name();
    }

    static PortDefDto toPortDef(Port p) {
        PortType t = p.getType();
        return t.isUserType()
                ? new PortDefDto(p.getName(), null, t.userType(), p.getWidth())
                : new PortDefDto(p.getName(), t.bitLength(), null, p.getWidth());
    }

    static PortType toPortType(PortDefDto def) {
        if (def.userType() != null && !def.userType().isBlank()) {
            return PortType.user(def.userType());
        }
        int length = def.bitLength() != null ? def.bitLength() : 1;
        if (length != PortType.ANY_LENGTH && length <= 0) {
            throw new LayoutFormatException(FORMAT, "Invalid bit length " + length + " on port '" + def.name() + "'");
        }
        return PortType.bits(length);
    }
}
