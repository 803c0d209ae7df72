package com.impetus.impetus_backend.model.domain;

import lombok.Getter;
import lombok.Setter;

import java.util.Objects;

/**
 * A typed, named terminal on a {@link Node}. The owner reference is a back-pointer only;
 * the node's port list owns the port.
 */
@Getter
public class Port {

    /** Caption width the editor draws when nothing else was chosen. */
    public static final double DEFAULT_WIDTH = 108;

    private final Node owner;
    private final PortSide side;

    @Setter
    private String name;

    private PortType type;

    @Setter
    private double width = DEFAULT_WIDTH;

    Port(Node owner, PortSide side, String name, PortType type) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.side = Objects.requireNonNull(side, "side");
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public void setType(PortType type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public boolean isInput() {
        return side == PortSide.INPUT;
    }

    public boolean isOutput() {
        return side == PortSide.OUTPUT;
    }

    /** Position of this port in its owner's input or output list. */
    public int index() {
        return (isInput() ? owner.getInputs() : owner.getOutputs()).indexOf(this);
    }

    @Override
    public String toString() {
        return owner.getId() + "." + name + ":" + type;
    }
}
