package com.uwb.positioning.service;

import com.uwb.positioning.algorithm.AnchorLayout;
import com.uwb.positioning.algorithm.AnchorRange;
import com.uwb.positioning.algorithm.PlanarPosition;
import com.uwb.positioning.algorithm.PositionSolver;
import com.uwb.positioning.calibration.CalibrationNormalizer;
import com.uwb.positioning.client.ReadingForwardingClient;
import com.uwb.positioning.dto.BatchSummary;
import com.uwb.positioning.dto.CalibratedReading;
import com.uwb.positioning.dto.PositionResult;
import com.uwb.positioning.dto.RawReading;
import com.uwb.positioning.dto.ResolvedPosition;
import com.uwb.positioning.dto.StoredReading;
import com.uwb.positioning.exception.EmptyBatchException;
import com.uwb.positioning.exception.IngestionStorageException;
import com.uwb.positioning.motion.MotionCache;
import com.uwb.positioning.motion.MotionDelta;
import com.uwb.positioning.motion.MotionUpdate;
import com.uwb.positioning.parser.TelemetryLineParser;
import com.uwb.positioning.repository.ProcessedPositionEntity;
import com.uwb.positioning.repository.RawReadingEntity;
import com.uwb.positioning.session.ReportSessionStateMachine;
import com.uwb.positioning.session.SessionCommand;
import com.uwb.positioning.session.SessionOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Sequences parsing, calibration, session handling, solving and storage for a batch.
 *
 * <p>This service: 1. Rejects batches without any usable input 2. Parses and calibrates each line
 * in input order 3. Applies inline session commands 4. Drops calibration-tag and command-0
 * readings 5. Either stores calibrated readings and forwards them (raw-ingest path) or solves
 * positions, attaches motion deltas and stores them (processing path) 6. Returns the batch
 * counters
 *
 * <p>Row-level problems are counted, never thrown. Only an empty batch and a storage failure
 * reach the caller as exceptions; a storage failure rolls back the whole batch, including the
 * motion cache updates it made.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TelemetryIngestionService {

    private static final String ERROR_EMPTY_BATCH = "Batch contains no telemetry";
    private static final String ERROR_STORAGE = "Failed to persist batch";
    private static final String ERROR_SESSION_STORAGE = "Failed to persist report session";

    private final TelemetryLineParser parser;
    private final CalibrationNormalizer normalizer;
    private final ReportSessionStateMachine sessionStateMachine;
    private final PositionSolver solver;
    private final MotionCache motionCache;
    private final BatchPersistenceService persistenceService;
    private final ReadingForwardingClient forwardingClient;
    private final IngestionMetrics metrics;
    private final Clock clock;

    /**
     * Raw-ingest path: stores calibrated readings, then forwards the committed rows.
     *
     * @param lines telemetry lines
     * @return batch counters
     */
    public BatchSummary ingestRaw(List<String> lines) {
        List<String> usable = requireLines(lines);
        BatchCounters counters = new BatchCounters(usable.size(), normalizer.currentOffset());
        log.info("Ingesting raw batch of {} lines", usable.size());

        List<CalibratedReading> eligible = prepare(usable, counters);
        List<RawReadingEntity> stored = persist(() -> persistenceService.saveRawReadings(eligible));
        counters.saved(stored.size());

        if (!stored.isEmpty()) {
            boolean forwarded = forwardingClient.forward(stored);
            counters.forwarded(forwarded);
            metrics.recordForwarding(forwarded);
        }

        return complete(counters);
    }

    /**
     * Processing path from telemetry lines: solves and stores a position per eligible reading.
     *
     * @param lines telemetry lines
     * @return batch counters with the stored positions
     */
    public BatchSummary processLines(List<String> lines) {
        List<String> usable = requireLines(lines);
        BatchCounters counters = new BatchCounters(usable.size(), normalizer.currentOffset());
        log.info("Processing batch of {} lines", usable.size());

        return resolveAndStore(prepare(usable, counters), counters);
    }

    /**
     * Processing path from readings that were calibrated and stored earlier. Stored readings carry
     * no command or user, so sessions are not touched.
     *
     * @param readings stored readings
     * @return batch counters with the stored positions
     */
    public BatchSummary processStored(List<StoredReading> readings) {
        List<StoredReading> usable = readings == null
            ? List.of()
            : readings.stream().filter(Objects::nonNull).toList();
        if (usable.isEmpty()) {
            metrics.recordRejectedBatch();
            throw new EmptyBatchException(ERROR_EMPTY_BATCH);
        }

        BatchCounters counters = new BatchCounters(usable.size(), normalizer.currentOffset());
        log.info("Processing batch of {} stored readings", usable.size());
        Instant receivedAt = clock.instant();

        List<CalibratedReading> eligible = new ArrayList<>();
        for (StoredReading reading : usable) {
            if (reading.tagNumber() == null || reading.tagNumber().isBlank()) {
                counters.invalid();
                continue;
            }
            CalibratedReading calibrated = normalizer.fromStored(
                reading.tagNumber(),
                reading.distances(),
                reading.kx(),
                reading.ky(),
                reading.capturedAt() != null ? reading.capturedAt() : receivedAt);
            if (calibrated.calibrationTag()) {
                counters.calibrationTag();
                continue;
            }
            eligible.add(calibrated);
        }

        return resolveAndStore(eligible, counters);
    }

    // ===== PIPELINE STAGES =====

    /**
     * Parses, calibrates and applies session commands, returning the readings eligible for
     * storage in input order.
     */
    private List<CalibratedReading> prepare(List<String> lines, BatchCounters counters) {
        Instant receivedAt = clock.instant();
        List<CalibratedReading> eligible = new ArrayList<>();

        for (String line : lines) {
            Optional<RawReading> parsed = parser.parse(line, receivedAt);
            if (parsed.isEmpty()) {
                counters.invalid();
                continue;
            }

            CalibratedReading reading = normalizer.normalize(parsed.get());
            counters.session(applySession(reading));

            if (reading.calibrationTag()) {
                log.debug("Skipping calibration tag {}", reading.tagId());
                counters.calibrationTag();
                continue;
            }
            if (SessionCommand.of(reading.command()) == SessionCommand.DISCARD) {
                log.debug("Discarding reading of tag {} with command 0", reading.tagId());
                counters.commandZero();
                continue;
            }
            eligible.add(reading);
        }
        return eligible;
    }

    private BatchSummary resolveAndStore(List<CalibratedReading> eligible, BatchCounters counters) {
        List<ProcessedPositionEntity> records = new ArrayList<>();
        List<MotionUpdate> motionUpdates = new ArrayList<>();

        for (CalibratedReading reading : eligible) {
            Optional<ResolvedPosition> resolved = resolve(reading);
            if (resolved.isEmpty()) {
                counters.unsolvable();
                continue;
            }
            ResolvedPosition position = resolved.get();
            MotionUpdate update = motionCache.record(
                position.tagId(), position.x(), position.y(), position.resolvedAt());
            motionUpdates.add(update);
            records.add(toRecord(position, update.delta()));
        }

        List<ProcessedPositionEntity> stored;
        try {
            stored = persist(() -> persistenceService.saveProcessedPositions(records));
        } catch (IngestionStorageException e) {
            revertMotion(motionUpdates);
            throw e;
        }
        counters.saved(stored.size());
        counters.positions(stored.stream().map(TelemetryIngestionService::toResult).toList());

        return complete(counters);
    }

    private Optional<ResolvedPosition> resolve(CalibratedReading reading) {
        Optional<AnchorLayout> layout = AnchorLayout.of(reading.spanX(), reading.spanY());
        if (layout.isEmpty()) {
            log.debug("Tag {} has no usable anchor span ({}, {})",
                reading.tagId(), reading.spanX(), reading.spanY());
            return Optional.empty();
        }

        List<AnchorRange> anchors = layout.get().validAnchors(reading);
        Optional<PlanarPosition> position = solver.solve(anchors);
        if (position.isEmpty()) {
            log.debug("Tag {} unsolvable with {} valid anchors", reading.tagId(), anchors.size());
            return Optional.empty();
        }

        return Optional.of(new ResolvedPosition(
            reading.tagId(), position.get().x(), position.get().y(), reading.capturedAt()));
    }

    private ProcessedPositionEntity toRecord(ResolvedPosition position, MotionDelta delta) {
        ProcessedPositionEntity entity = new ProcessedPositionEntity();
        entity.setTagNumber(position.tagId());
        entity.setX(position.x());
        entity.setY(position.y());
        entity.setDistanceTravelled(delta.distanceTravelled());
        entity.setElapsedSeconds(delta.elapsedSeconds());
        entity.setCreatedAt(position.resolvedAt());
        return entity;
    }

    private static PositionResult toResult(ProcessedPositionEntity entity) {
        return new PositionResult(
            entity.getTagNumber(),
            entity.getX(),
            entity.getY(),
            entity.getDistanceTravelled(),
            entity.getElapsedSeconds(),
            entity.getCreatedAt());
    }

    // ===== BATCH BOUNDARIES =====

    private List<String> requireLines(List<String> lines) {
        List<String> usable = lines == null
            ? List.of()
            : lines.stream().filter(line -> line != null && !line.isBlank()).toList();
        if (usable.isEmpty()) {
            metrics.recordRejectedBatch();
            throw new EmptyBatchException(ERROR_EMPTY_BATCH);
        }
        return usable;
    }

    private SessionOutcome applySession(CalibratedReading reading) {
        try {
            return sessionStateMachine.apply(reading);
        } catch (DataAccessException | TransactionException e) {
            log.error("Storage failure while updating report session of user {}: {}",
                reading.sessionUser(), e.getMessage(), e);
            metrics.recordRejectedBatch();
            throw new IngestionStorageException(ERROR_SESSION_STORAGE, e);
        }
    }

    private <T> List<T> persist(Supplier<List<T>> write) {
        try {
            return write.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("Storage failure, batch rolled back: {}", e.getMessage(), e);
            metrics.recordRejectedBatch();
            throw new IngestionStorageException(ERROR_STORAGE, e);
        }
    }

    /**
     * Undoes the cache updates of a batch whose positions were not stored, newest first.
     */
    private void revertMotion(List<MotionUpdate> updates) {
        for (int i = updates.size() - 1; i >= 0; i--) {
            motionCache.revert(updates.get(i));
        }
        log.debug("Reverted {} motion cache updates of a failed batch", updates.size());
    }

    private BatchSummary complete(BatchCounters counters) {
        BatchSummary summary = counters.toSummary();
        metrics.record(summary);
        log.info("Batch complete: saved={}, invalid={}, calibration={}, commandZero={}, "
            + "unsolvable={}, sessionsOpenedOrUpdated={}, sessionsClosed={}, forwarded={}",
            summary.saved(), summary.skippedInvalid(), summary.skippedCalibration(),
            summary.skippedCommandZero(), summary.skippedUnsolvable(),
            summary.sessionsOpenedOrUpdated(), summary.sessionsClosed(), summary.forwardedOk());
        return summary;
    }
}
