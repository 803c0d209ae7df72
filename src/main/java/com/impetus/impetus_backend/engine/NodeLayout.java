package com.impetus.impetus_backend.engine;

import com.impetus.impetus_backend.model.domain.Node;

import java.util.Collection;

/**
 * Cosmetic geometry used by the composition operations. Nothing here touches topology.
 */
public final class NodeLayout {

    static final double TITLE_HEIGHT = 28;
    static final double ROW_HEIGHT = 30;
    static final double BODY_PAD = 10;
    static final double MIN_WIDTH = 140;
    static final double MIN_HEIGHT = 80;

    private static final double HEADER_HEIGHT = 28;
    private static final double AREA_TOP_PAD = 60;
    private static final double AREA_BOTTOM_PAD = 40;
    private static final double AREA_SIDE_PAD = 160;

    /** Axis-aligned box in world units. */
    public record Box(double x, double y, double width, double height) {
        public double right() {
            return x + width;
        }

        public double bottom() {
            return y + height;
        }

        public double centerX() {
            return x + width / 2;
        }

        public double centerY() {
            return y + height / 2;
        }
    }

    private NodeLayout() {
    }

    /** Bounding box of the nodes, or null when there are none. */
    public static Box boundsOf(Collection<Node> nodes) {
        if (nodes.isEmpty()) return null;
        double minX = Double.MAX_VALUE, minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE, maxY = -Double.MAX_VALUE;
        for (Node n : nodes) {
            minX = Math.min(minX, n.getX());
            minY = Math.min(minY, n.getY());
            maxX = Math.max(maxX, n.getRight());
            maxY = Math.max(maxY, n.getBottom());
        }
        return new Box(minX, minY, maxX - minX, maxY - minY);
    }

    /** Grows (or with {@code allowShrink}, fits) the node's height to its port rows. */
    public static void autoSizeForPorts(Node n, boolean allowShrink) {
        int rows = Math.max(n.getInputs().size(), n.getOutputs().size());
        double needed = TITLE_HEIGHT + BODY_PAD + rows * ROW_HEIGHT + BODY_PAD;
        double newHeight = allowShrink ? needed : Math.max(n.getHeight(), needed);
        n.setWidth(Math.max(n.getWidth(), MIN_WIDTH));
        n.setHeight(Math.max(newHeight, MIN_HEIGHT));
    }

    public static void translate(Collection<Node> nodes, double dx, double dy) {
        for (Node n : nodes) {
            n.setX(n.getX() + dx);
            n.setY(n.getY() + dy);
        }
    }

    /**
     * Working area of a level: the nominal viewport, shifted by the level's view offset and
     * inset for the breadcrumb header and proxy columns.
     */
    public static Box workingArea(double viewOffsetX, double viewOffsetY, double viewportWidth, double viewportHeight) {
        double x = -viewOffsetX + AREA_SIDE_PAD;
        double y = -viewOffsetY + HEADER_HEIGHT + AREA_TOP_PAD;
        double w = Math.max(200, viewportWidth - AREA_SIDE_PAD * 2);
        double h = Math.max(160, viewportHeight - (HEADER_HEIGHT + AREA_TOP_PAD + AREA_BOTTOM_PAD));
        return new Box(x, y, w, h);
    }

    /** Centers the nodes in {@code area}, then pulls them back inside it by {@code pad}. */
    public static void placeInto(Collection<Node> nodes, Box area, double pad) {
        Box bb = boundsOf(nodes);
        if (bb == null || bb.width() <= 0 || bb.height() <= 0) return;

        translate(nodes, area.centerX() - bb.centerX(), area.centerY() - bb.centerY());

        bb = boundsOf(nodes);
        double dx = 0, dy = 0;
        if (bb.x() < area.x() + pad) dx += (area.x() + pad) - bb.x();
        if (bb.right() > area.right() - pad) dx += (area.right() - pad) - bb.right();
        if (bb.y() < area.y() + pad) dy += (area.y() + pad) - bb.y();
        if (bb.bottom() > area.bottom() - pad) dy += (area.bottom() - pad) - bb.bottom();
        if (dx != 0 || dy != 0) translate(nodes, dx, dy);
    }
}
