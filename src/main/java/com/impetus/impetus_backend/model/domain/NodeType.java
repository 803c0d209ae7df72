package com.impetus.impetus_backend.model.domain;

import java.util.List;

public enum NodeType {
    REGULAR("Regular",
            List.of(new PortTemplate("In", PortType.BIT)),
            List.of(new PortTemplate("Out", PortType.BIT))),
    START("Start",           // grows one more single-bit output each time the last one is wired
            List.of(),
            List.of(new PortTemplate("Out1", PortType.BIT))),
    END("End",               // grows one more any-length input each time the last one is wired
            List.of(new PortTemplate("In1", PortType.ANY)),
            List.of()),
    CONST("Const",
            List.of(new PortTemplate("Trigger", PortType.ANY)),
            List.of(new PortTemplate("Value", PortType.BIT))),
    ADD("Add",
            List.of(new PortTemplate("A", PortType.bits(32)), new PortTemplate("B", PortType.bits(32))),
            List.of(new PortTemplate("Sum", PortType.bits(32)),
                    new PortTemplate("Carry", PortType.BIT),
                    new PortTemplate("Overflow", PortType.BIT))),
    DECISION("Decision",
            List.of(new PortTemplate("Input", PortType.bits(8))),
            List.of(new PortTemplate("FALSE", PortType.BIT), new PortTemplate("TRUE", PortType.BIT))),
    MARSHALLER("Marshaller", // construction shape: two bits in, combined word out
            List.of(new PortTemplate("In1", PortType.BIT), new PortTemplate("In2", PortType.BIT)),
            List.of(new PortTemplate("Out", PortType.bits(2)))),
    NULL_CONSUMER("NullConsumer",
            List.of(new PortTemplate("In", PortType.ANY)),
            List.of());

    /** Name and type of a port a fresh node of this variant starts with. */
    public record PortTemplate(String name, PortType type) {}

    private final String label;
    private final List<PortTemplate> defaultInputs;
    private final List<PortTemplate> defaultOutputs;

    NodeType(String label, List<PortTemplate> defaultInputs, List<PortTemplate> defaultOutputs) {
        this.label = label;
        this.defaultInputs = defaultInputs;
        this.defaultOutputs = defaultOutputs;
    }

    public String label() {
        return label;
    }

    public List<PortTemplate> defaultInputs() {
        return defaultInputs;
    }

    public List<PortTemplate> defaultOutputs() {
        return defaultOutputs;
    }

    public boolean growsInputs() {
        return this == END;
    }

    public boolean growsOutputs() {
        return this == START;
    }

    public double defaultWidth() {
        return switch (this) {
            case MARSHALLER -> 80;
            case NULL_CONSUMER -> 120;
            default -> Node.DEFAULT_WIDTH;
        };
    }

    public double defaultHeight() {
        return switch (this) {
            case MARSHALLER -> 160;
            case NULL_CONSUMER -> 24;
            default -> Node.DEFAULT_HEIGHT;
        };
    }

    /** Case-insensitive lookup by persisted label; unknown or blank values map to {@link #REGULAR}. */
    public static NodeType fromLabel(String value) {
        if (value == null || value.isBlank()) return REGULAR;
        String v = value.trim();
        for (NodeType t : values()) {
            if (t.label.equalsIgnoreCase(v) || t.name().equalsIgnoreCase(v)) return t;
        }
        return REGULAR;
    }
}
