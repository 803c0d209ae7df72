package com.impetus.impetus_backend.model.dto;

import java.util.List;

// nodeIds null: group the current selection
public record GroupRequest(List<String> nodeIds, String name) {}
