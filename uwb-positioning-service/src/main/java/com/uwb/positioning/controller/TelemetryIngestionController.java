package com.uwb.positioning.controller;

import com.uwb.positioning.dto.BatchSummary;
import com.uwb.positioning.dto.StoredReadingBatchRequest;
import com.uwb.positioning.dto.TelemetryBatchRequest;
import com.uwb.positioning.service.TelemetryIngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for UWB telemetry ingestion.
 * Batch-level faults are translated by {@link GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/v1/uwb")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "UWB Ingestion", description = "Endpoints for raw telemetry ingestion and position processing")
public class TelemetryIngestionController {

    private final TelemetryIngestionService ingestionService;

    @Operation(summary = "Ingest raw telemetry", description = "Stores calibrated distance readings "
            + "from telemetry lines and forwards the committed rows downstream.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Batch processed", content = @Content(schema = @Schema(implementation = BatchSummary.class))),
            @ApiResponse(responseCode = "400", description = "Empty batch or malformed request"),
            @ApiResponse(responseCode = "500", description = "Batch could not be persisted")
    })
    @PostMapping("/raw-readings/ingest")
    public ResponseEntity<BatchSummary> ingestRawReadings(@Valid @RequestBody TelemetryBatchRequest request) {
        log.debug("Received raw ingest request with {} payload items", request.getPayload().size());
        return ResponseEntity.ok(ingestionService.ingestRaw(request.lines()));
    }

    @Operation(summary = "Process telemetry into positions", description = "Solves and stores a tag "
            + "position with motion delta for every eligible telemetry line.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Batch processed", content = @Content(schema = @Schema(implementation = BatchSummary.class))),
            @ApiResponse(responseCode = "400", description = "Empty batch or malformed request"),
            @ApiResponse(responseCode = "500", description = "Batch could not be persisted")
    })
    @PostMapping("/positions/ingest")
    public ResponseEntity<BatchSummary> processTelemetry(@Valid @RequestBody TelemetryBatchRequest request) {
        log.debug("Received processing request with {} payload items", request.getPayload().size());
        return ResponseEntity.ok(ingestionService.processLines(request.lines()));
    }

    @Operation(summary = "Process stored readings into positions", description = "Solves and stores "
            + "positions for readings that were calibrated and stored earlier.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Batch processed", content = @Content(schema = @Schema(implementation = BatchSummary.class))),
            @ApiResponse(responseCode = "400", description = "Empty batch or malformed request"),
            @ApiResponse(responseCode = "500", description = "Batch could not be persisted")
    })
    @PostMapping("/positions/calculate")
    public ResponseEntity<BatchSummary> calculatePositions(@Valid @RequestBody StoredReadingBatchRequest request) {
        log.debug("Received calculation request with {} readings", request.getReadings().size());
        return ResponseEntity.ok(ingestionService.processStored(request.getReadings()));
    }
}
