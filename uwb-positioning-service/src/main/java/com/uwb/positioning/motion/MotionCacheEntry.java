package com.uwb.positioning.motion;

import java.time.Instant;

/**
 * Last resolved fix of a tag.
 */
public record MotionCacheEntry(String tagId, double lastX, double lastY, Instant lastTimestamp) {
}
