package com.impetus.impetus_backend.model.domain;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * A block on the canvas. A node may own a nested {@link Graph} ({@link #getInner()}), which
 * makes it a composite block. Proxy nodes are the placeholders inside such an inner graph
 * that stand for the composite's own ports; they carry exactly one port and never an inner graph.
 */
@Getter
@Setter
public class Node {

    public static final double DEFAULT_WIDTH = 190;
    public static final double DEFAULT_HEIGHT = 98;
    public static final String DEFAULT_CONST_VALUE = "0";

    private String id;
    private String title;
    private NodeType type;

    private double x;
    private double y;
    private double width;
    private double height;

    private Graph inner;
    private boolean permanent;

    private boolean proxy;
    private boolean proxyIsInlet;
    private int proxyIndex;

    private String constValue = DEFAULT_CONST_VALUE;
    private String marshallerOutputType;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final List<Port> inputs = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final List<Port> outputs = new ArrayList<>();

    /** Node without any ports. Used by load, clone and grouping, which fill in ports themselves. */
    public Node(String title, double x, double y, NodeType type) {
        this.id = newId();
        this.title = title != null ? title : "";
        this.type = type != null ? type : NodeType.REGULAR;
        this.x = x;
        this.y = y;
        this.width = this.type.defaultWidth();
        this.height = this.type.defaultHeight();
    }

    /** Node carrying the default ports of its variant. */
    public static Node withDefaultPorts(String title, double x, double y, NodeType type) {
        Node n = new Node(title, x, y, type);
        n.type.defaultInputs().forEach(t -> n.addInput(t.name(), t.type()));
        n.type.defaultOutputs().forEach(t -> n.addOutput(t.name(), t.type()));
        return n;
    }

    /** Placeholder mirroring {@code mirrored}: an inlet gets one output, an outlet one input. */
    public static Node proxyFor(Port mirrored, boolean inlet, int index) {
        Node pn = new Node(mirrored.getName(), 0, 0, NodeType.REGULAR);
        pn.id = (inlet ? "inlet_" : "outlet_") + index;
        pn.proxy = true;
        pn.proxyIsInlet = inlet;
        pn.proxyIndex = index;
        if (inlet) {
            pn.addOutput(mirrored.getName(), mirrored.getType());
        } else {
            pn.addInput(mirrored.getName(), mirrored.getType());
        }
        return pn;
    }

    /** 32 hex characters, no dashes. */
    public static String newId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public List<Port> getInputs() {
        return Collections.unmodifiableList(inputs);
    }

    public List<Port> getOutputs() {
        return Collections.unmodifiableList(outputs);
    }

    public List<Port> ports(PortSide side) {
        return side == PortSide.INPUT ? getInputs() : getOutputs();
    }

    public Port addInput(String name, PortType type) {
        Port p = new Port(this, PortSide.INPUT, name, type);
        inputs.add(p);
        return p;
    }

    public Port addOutput(String name, PortType type) {
        Port p = new Port(this, PortSide.OUTPUT, name, type);
        outputs.add(p);
        return p;
    }

    public Port addPort(PortSide side, String name, PortType type) {
        return side == PortSide.INPUT ? addInput(name, type) : addOutput(name, type);
    }

    /** Detaches the port from this node. Edges are the owning graph's business. */
    public boolean removePort(Port port) {
        return port.isInput() ? inputs.remove(port) : outputs.remove(port);
    }

    /** First port on the given side with exactly this name, or null. */
    public Port findPort(PortSide side, String name) {
        for (Port p : side == PortSide.INPUT ? inputs : outputs) {
            if (p.getName().equals(name)) return p;
        }
        return null;
    }

    public boolean isComposite() {
        return inner != null;
    }

    /**
     * Appends the next port of a growing variant: {@code OutN} on Start, {@code InN} on End.
     * Returns null for variants that do not grow.
     */
    public Port appendNextDefaultPort() {
        if (type.growsOutputs()) {
            return addOutput("Out" + (outputs.size() + 1), PortType.BIT);
        }
        if (type.growsInputs()) {
            return addInput("In" + (inputs.size() + 1), PortType.ANY);
        }
        return null;
    }

    public double getRight() {
        return x + width;
    }

    public double getBottom() {
        return y + height;
    }

    @Override
    public String toString() {
        return "Node[" + id + " '" + title + "' " + type.label() + (proxy ? (proxyIsInlet ? " inlet#" : " outlet#") + proxyIndex : "") + "]";
    }
}
