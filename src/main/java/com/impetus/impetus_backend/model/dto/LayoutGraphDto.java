package com.impetus.impetus_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * One level of the hierarchy. Null-safe: null lists are treated as empty.
 */
public record LayoutGraphDto(
    @JsonProperty("nodes") List<NodeDto> nodes,
    @JsonProperty("edges") List<EdgeDto> edges,
    @JsonProperty("vx") Double vx,
    @JsonProperty("vy") Double vy
) {
    public static LayoutGraphDto empty() {
        return new LayoutGraphDto(List.of(), List.of(), 0.0, 0.0);
    }

    public List<NodeDto> nodes() {
        return nodes != null ? nodes : Collections.emptyList();
    }

    public List<EdgeDto> edges() {
        return edges != null ? edges : Collections.emptyList();
    }

    public Double vx() {
        return vx != null ? vx : 0.0;
    }

    public Double vy() {
        return vy != null ? vy : 0.0;
    }
}
