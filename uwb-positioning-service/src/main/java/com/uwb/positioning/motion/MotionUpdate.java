package com.uwb.positioning.motion;

/**
 * A fix written to the motion cache together with the entry it replaced.
 *
 * @param previous entry before the update, {@code null} on a tag's first fix
 * @param current entry written by the update
 * @param delta movement from {@code previous} to {@code current}
 */
public record MotionUpdate(MotionCacheEntry previous, MotionCacheEntry current, MotionDelta delta) {
}
