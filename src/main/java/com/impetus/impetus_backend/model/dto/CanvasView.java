package com.impetus.impetus_backend.model.dto;

import java.util.List;

/**
 * What the editor shows: the active level, the breadcrumb trail leading to it and the selection.
 */
public record CanvasView(int level, List<TrailEntry> trail, List<String> selection, LayoutGraphDto graph) {

    public record TrailEntry(String id, String title) {}
}
