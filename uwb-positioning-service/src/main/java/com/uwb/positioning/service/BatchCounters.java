package com.uwb.positioning.service;

import com.uwb.positioning.dto.BatchSummary;
import com.uwb.positioning.dto.PositionResult;
import com.uwb.positioning.session.SessionOutcome;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable tally of one batch, turned into a {@link BatchSummary} once the batch completes.
 */
class BatchCounters {

    private final int receivedLines;
    private final double calibrationOffset;
    private final List<PositionResult> positions = new ArrayList<>();

    private int saved;
    private int skippedInvalid;
    private int skippedCalibration;
    private int skippedCommandZero;
    private int skippedUnsolvable;
    private int sessionsOpenedOrUpdated;
    private int sessionsClosed;
    private boolean forwardedOk;

    BatchCounters(int receivedLines, double calibrationOffset) {
        this.receivedLines = receivedLines;
        this.calibrationOffset = calibrationOffset;
    }

    void invalid() {
        skippedInvalid++;
    }

    void calibrationTag() {
        skippedCalibration++;
    }

    void commandZero() {
        skippedCommandZero++;
    }

    void unsolvable() {
        skippedUnsolvable++;
    }

    void session(SessionOutcome outcome) {
        if (outcome.isOpenedOrUpdated()) {
            sessionsOpenedOrUpdated++;
        } else if (outcome == SessionOutcome.CLOSED) {
            sessionsClosed++;
        }
    }

    void saved(int count) {
        saved = count;
    }

    void positions(List<PositionResult> stored) {
        positions.addAll(stored);
    }

    void forwarded(boolean ok) {
        forwardedOk = ok;
    }

    BatchSummary toSummary() {
        return new BatchSummary(
            receivedLines,
            saved,
            skippedInvalid,
            skippedCalibration,
            skippedCommandZero,
            skippedUnsolvable,
            sessionsOpenedOrUpdated,
            sessionsClosed,
            forwardedOk,
            calibrationOffset,
            positions);
    }
}
