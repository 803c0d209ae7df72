package com.impetus.impetus_backend.model.dto;

// Either field may be null: only the fields present are changed
public record NodeUpdateRequest(String title, String constValue) {}
