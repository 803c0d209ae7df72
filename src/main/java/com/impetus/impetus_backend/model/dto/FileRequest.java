package com.impetus.impetus_backend.model.dto;

import jakarta.validation.constraints.NotBlank;

/** {@code format} is "SEXPR" or "JSON"; when absent on save the file extension, then the configured default, decides. */
public record FileRequest(@NotBlank String path, String format) {}
