package com.impetus.impetus_backend.codec;

public enum LayoutFormat {
    SEXPR(".bcanvas"),
    JSON(".json");

    private final String extension;

    LayoutFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }
}
