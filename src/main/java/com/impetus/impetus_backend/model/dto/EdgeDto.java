package com.impetus.impetus_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A wire, addressed by node id and port name on each end.
 */
public record EdgeDto(
    @JsonProperty("from") PortRefDto from,
    @JsonProperty("to") PortRefDto to
) {
    public static EdgeDto of(String fromNode, String fromPort, String toNode, String toPort) {
        return new EdgeDto(
                new PortRefDto(fromNode, "Output", fromPort),
                new PortRefDto(toNode, "Input", toPort));
    }
}
