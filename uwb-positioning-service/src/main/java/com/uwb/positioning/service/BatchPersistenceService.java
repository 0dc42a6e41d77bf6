package com.uwb.positioning.service;

import com.uwb.positioning.dto.CalibratedReading;
import com.uwb.positioning.repository.ProcessedPositionEntity;
import com.uwb.positioning.repository.ProcessedPositionRepository;
import com.uwb.positioning.repository.RawReadingEntity;
import com.uwb.positioning.repository.RawReadingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Transaction boundary of a batch: either every eligible row of the batch is committed or none.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchPersistenceService {

    private final RawReadingRepository rawReadingRepository;
    private final ProcessedPositionRepository processedPositionRepository;

    @Transactional
    public List<RawReadingEntity> saveRawReadings(List<CalibratedReading> readings) {
        if (readings.isEmpty()) {
            return List.of();
        }
        List<RawReadingEntity> saved = rawReadingRepository.saveAll(
            readings.stream().map(RawReadingEntity::from).toList());
        log.debug("Persisted {} raw readings", saved.size());
        return saved;
    }

    @Transactional
    public List<ProcessedPositionEntity> saveProcessedPositions(List<ProcessedPositionEntity> positions) {
        if (positions.isEmpty()) {
            return List.of();
        }
        List<ProcessedPositionEntity> saved = processedPositionRepository.saveAll(positions);
        log.debug("Persisted {} processed positions", saved.size());
        return saved;
    }
}
