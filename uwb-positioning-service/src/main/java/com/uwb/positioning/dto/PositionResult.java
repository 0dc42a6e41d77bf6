package com.uwb.positioning.dto;

import java.time.Instant;

/**
 * Stored position as reported back to the caller of the processing endpoints.
 */
public record PositionResult(
    String tagId,
    double x,
    double y,
    Double distanceTravelled,
    Long elapsedSeconds,
    Instant recordedAt) {
}
