package com.uwb.positioning.calibration;

import com.uwb.positioning.config.UwbProperties;
import com.uwb.positioning.dto.CalibratedReading;
import com.uwb.positioning.dto.RawReading;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.util.Precision;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Applies the calibration offset to raw readings.
 *
 * <p>The anchors report 0 when they have no measurement. After the offset is subtracted that
 * becomes the no-reading sentinel {@code -offset}; slots holding the sentinel keep their value
 * for storage but are flagged so the solver ignores them. Readings from reserved calibration tags
 * are flagged as well.
 */
@Component
@RequiredArgsConstructor
public class CalibrationNormalizer {

    private final UwbProperties properties;

    /**
     * Subtracts the offset from every present distance and span value.
     *
     * @param reading the parsed reading
     * @param offset calibration offset
     * @return the calibrated reading
     */
    public CalibratedReading normalize(RawReading reading, double offset) {
        List<Double> calibrated = new ArrayList<>(RawReading.SLOT_COUNT);
        for (Double distance : reading.distances()) {
            calibrated.add(distance == null ? null : distance - offset);
        }

        return new CalibratedReading(
            reading.tagId(),
            calibrated,
            noReadingSlots(calibrated, offset),
            subtract(reading.spanX(), offset),
            subtract(reading.spanY(), offset),
            reading.command(),
            reading.sessionUser(),
            reading.capturedAt(),
            offset,
            isCalibrationTag(reading.tagId()));
    }

    /**
     * Normalizes with the configured offset.
     */
    public CalibratedReading normalize(RawReading reading) {
        return normalize(reading, currentOffset());
    }

    /**
     * Builds a calibrated reading from values that were already calibrated when stored. Only the
     * sentinel flags are computed; the offset is not subtracted again.
     */
    public CalibratedReading fromStored(String tagId, List<Double> distances, Double spanX, Double spanY,
                                        Instant capturedAt) {
        double offset = currentOffset();
        List<Double> slots = new ArrayList<>(RawReading.SLOT_COUNT);
        for (int slot = 0; slot < RawReading.SLOT_COUNT; slot++) {
            slots.add(distances != null && slot < distances.size() ? distances.get(slot) : null);
        }
        return new CalibratedReading(
            tagId,
            slots,
            noReadingSlots(slots, offset),
            spanX,
            spanY,
            0,
            null,
            capturedAt,
            offset,
            isCalibrationTag(tagId));
    }

    public boolean isCalibrationTag(String tagId) {
        return tagId != null && properties.getCalibration().getTags().contains(tagId);
    }

    public double currentOffset() {
        return properties.getCalibration().getOffset();
    }

    private Set<Integer> noReadingSlots(List<Double> calibrated, double offset) {
        double sentinel = -offset;
        double tolerance = properties.getCalibration().getSentinelTolerance();
        Set<Integer> slots = new HashSet<>();
        for (int slot = 0; slot < calibrated.size(); slot++) {
            Double value = calibrated.get(slot);
            if (value != null && Precision.equals(value, sentinel, tolerance)) {
                slots.add(slot);
            }
        }
        return slots;
    }

    private static Double subtract(Double value, double offset) {
        return value == null ? null : value - offset;
    }
}
