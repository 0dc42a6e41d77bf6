package com.uwb.positioning.service;

import com.uwb.positioning.dto.BatchSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Micrometer counters mirroring the batch summary.
 */
@Component
public class IngestionMetrics {

    private static final String SKIPPED = "uwb.ingest.rows.skipped";
    private static final String SESSIONS = "uwb.sessions.transitions";
    private static final String FORWARDING = "uwb.forwarding.batches";

    private final Counter linesReceived;
    private final Counter rowsSaved;
    private final Counter skippedInvalid;
    private final Counter skippedCalibration;
    private final Counter skippedCommandZero;
    private final Counter skippedUnsolvable;
    private final Counter sessionsOpenedOrUpdated;
    private final Counter sessionsClosed;
    private final Counter forwardingSucceeded;
    private final Counter forwardingFailed;
    private final Counter batchesRejected;

    public IngestionMetrics(MeterRegistry meterRegistry) {
        this.linesReceived = Counter.builder("uwb.ingest.lines.received")
            .description("Non-blank telemetry items received")
            .register(meterRegistry);
        this.rowsSaved = Counter.builder("uwb.ingest.rows.saved")
            .description("Rows committed by ingestion batches")
            .register(meterRegistry);
        this.skippedInvalid = skipped(meterRegistry, "invalid");
        this.skippedCalibration = skipped(meterRegistry, "calibration_tag");
        this.skippedCommandZero = skipped(meterRegistry, "command_zero");
        this.skippedUnsolvable = skipped(meterRegistry, "unsolvable");
        this.sessionsOpenedOrUpdated = Counter.builder(SESSIONS)
            .tag("outcome", "opened_or_updated")
            .register(meterRegistry);
        this.sessionsClosed = Counter.builder(SESSIONS)
            .tag("outcome", "closed")
            .register(meterRegistry);
        this.forwardingSucceeded = Counter.builder(FORWARDING)
            .tag("result", "success")
            .register(meterRegistry);
        this.forwardingFailed = Counter.builder(FORWARDING)
            .tag("result", "failure")
            .register(meterRegistry);
        this.batchesRejected = Counter.builder("uwb.ingest.batches.rejected")
            .description("Batches rejected as empty or failed at storage")
            .register(meterRegistry);
    }

    public void record(BatchSummary summary) {
        linesReceived.increment(summary.receivedLines());
        rowsSaved.increment(summary.saved());
        skippedInvalid.increment(summary.skippedInvalid());
        skippedCalibration.increment(summary.skippedCalibration());
        skippedCommandZero.increment(summary.skippedCommandZero());
        skippedUnsolvable.increment(summary.skippedUnsolvable());
        sessionsOpenedOrUpdated.increment(summary.sessionsOpenedOrUpdated());
        sessionsClosed.increment(summary.sessionsClosed());
    }

    public void recordForwarding(boolean success) {
        (success ? forwardingSucceeded : forwardingFailed).increment();
    }

    public void recordRejectedBatch() {
        batchesRejected.increment();
    }

    private static Counter skipped(MeterRegistry meterRegistry, String reason) {
        return Counter.builder(SKIPPED)
            .tag("reason", reason)
            .register(meterRegistry);
    }
}
