package com.uwb.positioning.dto;

import java.time.Instant;

/**
 * Solver output for one reading, before the motion delta is attached and it is stored.
 */
public record ResolvedPosition(String tagId, double x, double y, Instant resolvedAt) {
}
