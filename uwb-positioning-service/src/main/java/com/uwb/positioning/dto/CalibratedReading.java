package com.uwb.positioning.dto;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A reading after the calibration offset has been applied.
 *
 * <p>{@code distances} keeps the calibrated numeric value of every present slot, including the
 * no-reading sentinel, because that is what gets stored. Slots listed in {@code noReadingSlots}
 * are excluded from solving.
 */
public record CalibratedReading(
    String tagId,
    List<Double> distances,
    Set<Integer> noReadingSlots,
    Double spanX,
    Double spanY,
    int command,
    String sessionUser,
    Instant capturedAt,
    double offset,
    boolean calibrationTag) {

    public CalibratedReading {
        if (distances == null || distances.size() != RawReading.SLOT_COUNT) {
            throw new IllegalArgumentException(
                "A reading must carry exactly " + RawReading.SLOT_COUNT + " distance slots");
        }
        distances = Collections.unmodifiableList(new ArrayList<>(distances));
        noReadingSlots = noReadingSlots == null ? Set.of() : Set.copyOf(noReadingSlots);
    }

    public Double distance(int slot) {
        return distances.get(slot);
    }

    public boolean isNoReading(int slot) {
        return noReadingSlots.contains(slot);
    }

    /**
     * Distance usable for solving: present and not the no-reading sentinel.
     */
    public Optional<Double> usableDistance(int slot) {
        Double value = distances.get(slot);
        if (value == null || isNoReading(slot)) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public boolean hasSessionUser() {
        return sessionUser != null && !sessionUser.isBlank();
    }
}
