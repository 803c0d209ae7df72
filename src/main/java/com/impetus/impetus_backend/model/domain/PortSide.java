package com.impetus.impetus_backend.model.domain;

public enum PortSide {
    INPUT,
    OUTPUT;

    /** "Input" / "Output", the spelling used in persisted layouts. */
    public String label() {
        return this == INPUT ? "Input" : "Output";
    }

    public static PortSide fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Port side is required");
        }
        return PortSide.valueOf(value.trim().toUpperCase());
    }
}
