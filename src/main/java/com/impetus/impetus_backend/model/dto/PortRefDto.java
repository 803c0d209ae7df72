package com.impetus.impetus_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PortRefDto(
    @JsonProperty("node") String nodeId,
    @JsonProperty("side") String side,
    @JsonProperty("port") String port
) {}
