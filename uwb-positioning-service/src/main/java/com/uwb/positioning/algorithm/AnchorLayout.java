package com.uwb.positioning.algorithm;

import com.uwb.positioning.dto.CalibratedReading;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rectangle of four anchors spanned by a reading's {@code kx}/{@code ky} values.
 *
 * <pre>
 *   A2 (0, ky) ------- A3 (kx, ky)
 *       |                  |
 *   A0 (0, 0)  ------- A1 (kx, 0)
 * </pre>
 *
 * Derived per reading and never stored. Distance slots 4-7 have no anchor position and are
 * never used.
 */
public record AnchorLayout(double spanX, double spanY) {

    public static final int ANCHOR_COUNT = 4;

    /**
     * Builds the layout when both span dimensions are present and strictly positive.
     */
    public static Optional<AnchorLayout> of(Double spanX, Double spanY) {
        if (spanX == null || spanY == null || !(spanX > 0) || !(spanY > 0)
            || !Double.isFinite(spanX) || !Double.isFinite(spanY)) {
            return Optional.empty();
        }
        return Optional.of(new AnchorLayout(spanX, spanY));
    }

    public PlanarPosition corner(int slot) {
        return switch (slot) {
            case 0 -> new PlanarPosition(0.0, 0.0);
            case 1 -> new PlanarPosition(spanX, 0.0);
            case 2 -> new PlanarPosition(0.0, spanY);
            case 3 -> new PlanarPosition(spanX, spanY);
            default -> throw new IllegalArgumentException("No anchor position for slot " + slot);
        };
    }

    /**
     * Pairs each corner with its distance when that distance is present, not the no-reading
     * sentinel and strictly positive. Slot order is preserved.
     */
    public List<AnchorRange> validAnchors(CalibratedReading reading) {
        List<AnchorRange> anchors = new ArrayList<>(ANCHOR_COUNT);
        for (int slot = 0; slot < ANCHOR_COUNT; slot++) {
            Optional<Double> distance = reading.usableDistance(slot);
            if (distance.isPresent() && distance.get() > 0 && Double.isFinite(distance.get())) {
                PlanarPosition corner = corner(slot);
                anchors.add(new AnchorRange(slot, corner.x(), corner.y(), distance.get()));
            }
        }
        return anchors;
    }
}
