package com.uwb.positioning.dto;

import com.uwb.positioning.repository.RawReadingEntity;

import java.time.Instant;
import java.util.List;

/**
 * Wire form of a stored, calibrated reading. Emitted by the forwarding client and accepted by the
 * structured processing endpoint.
 */
public record StoredReading(
    Long id,
    String tagNumber,
    List<Double> distances,
    Double kx,
    Double ky,
    Instant capturedAt) {

    public static StoredReading from(RawReadingEntity entity) {
        return new StoredReading(
            entity.getId(),
            entity.getTagNumber(),
            entity.distances(),
            entity.getKx(),
            entity.getKy(),
            entity.getCreatedAt());
    }
}
