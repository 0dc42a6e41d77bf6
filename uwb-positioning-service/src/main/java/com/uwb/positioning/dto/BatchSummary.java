package com.uwb.positioning.dto;

import java.util.List;

/**
 * Aggregate outcome of one ingestion batch.
 *
 * @param receivedLines number of non-blank input items
 * @param saved rows committed in the batch transaction
 * @param skippedInvalid lines missing the tag id or the distance list
 * @param skippedCalibration readings from reserved calibration tags
 * @param skippedCommandZero readings discarded by command 0
 * @param skippedUnsolvable readings without a solvable anchor geometry (processing path only)
 * @param sessionsOpenedOrUpdated report sessions created or refreshed by command 1
 * @param sessionsClosed report sessions closed by command 3
 * @param forwardedOk whether the committed rows were accepted downstream (raw-ingest path only)
 * @param calibrationOffset offset applied to the batch
 * @param positions positions stored by the processing path, in input order
 */
public record BatchSummary(
    int receivedLines,
    int saved,
    int skippedInvalid,
    int skippedCalibration,
    int skippedCommandZero,
    int skippedUnsolvable,
    int sessionsOpenedOrUpdated,
    int sessionsClosed,
    boolean forwardedOk,
    double calibrationOffset,
    List<PositionResult> positions) {

    public BatchSummary {
        positions = positions == null ? List.of() : List.copyOf(positions);
    }
}
