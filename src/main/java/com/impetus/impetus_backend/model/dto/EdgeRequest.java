package com.impetus.impetus_backend.model.dto;

import jakarta.validation.constraints.NotBlank;

public record EdgeRequest(
    @NotBlank String fromNode,
    @NotBlank String fromPort,
    @NotBlank String toNode,
    @NotBlank String toPort
) {}
