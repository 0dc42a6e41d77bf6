package com.uwb.positioning.motion;

/**
 * Movement of a tag since its previous fix. Both values are {@code null} on a tag's first fix.
 *
 * @param distanceTravelled Euclidean distance from the previous fix
 * @param elapsedSeconds whole seconds since the previous fix, never negative
 */
public record MotionDelta(Double distanceTravelled, Long elapsedSeconds) {

    private static final MotionDelta FIRST_FIX = new MotionDelta(null, null);

    public static MotionDelta firstFix() {
        return FIRST_FIX;
    }

    public boolean isFirstFix() {
        return distanceTravelled == null && elapsedSeconds == null;
    }
}
