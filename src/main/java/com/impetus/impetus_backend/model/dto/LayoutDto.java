package com.impetus.impetus_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of a persisted layout. Both the S-expression and the JSON codec read and write this tree.
 */
public record LayoutDto(
    @JsonProperty("version") Integer version,
    @JsonProperty("graph") LayoutGraphDto graph
) {
    public static final int CURRENT_VERSION = 2;

    public Integer version() {
        return version != null ? version : CURRENT_VERSION;
    }

    public LayoutGraphDto graph() {
        return graph != null ? graph : LayoutGraphDto.empty();
    }
}
