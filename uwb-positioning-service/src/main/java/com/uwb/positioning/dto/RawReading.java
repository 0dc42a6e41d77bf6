package com.uwb.positioning.dto;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single telemetry line as reported by the anchors, before calibration.
 *
 * <p>Always carries exactly {@link #SLOT_COUNT} distance slots (A0..A7). A slot without a usable
 * value holds {@code null}; missing values are never zero-filled.
 *
 * @param tagId numeric tag identifier, kept as the digits that appeared on the line
 * @param distances raw distances per anchor slot, {@code null} when absent
 * @param spanX anchor rectangle width ({@code kx}), {@code null} when absent
 * @param spanY anchor rectangle height ({@code ky}), {@code null} when absent
 * @param command inline command code, 0 when the line carries none
 * @param sessionUser report session user, {@code null} when absent
 * @param capturedAt ingestion timestamp
 */
public record RawReading(
    String tagId,
    List<Double> distances,
    Double spanX,
    Double spanY,
    int command,
    String sessionUser,
    Instant capturedAt) {

    public static final int SLOT_COUNT = 8;

    public RawReading {
        if (distances == null || distances.size() != SLOT_COUNT) {
            throw new IllegalArgumentException("A reading must carry exactly " + SLOT_COUNT + " distance slots");
        }
        distances = Collections.unmodifiableList(new ArrayList<>(distances));
    }

    public Double distance(int slot) {
        return distances.get(slot);
    }

    public boolean hasSessionUser() {
        return sessionUser != null && !sessionUser.isBlank();
    }
}
