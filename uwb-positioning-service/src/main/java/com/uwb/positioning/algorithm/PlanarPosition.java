package com.uwb.positioning.algorithm;

/**
 * A point in the anchor rectangle's coordinate frame.
 */
public record PlanarPosition(double x, double y) {

    public double distanceTo(PlanarPosition other) {
        return Math.hypot(x - other.x, y - other.y);
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }
}
