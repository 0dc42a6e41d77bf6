package com.uwb.positioning.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Objects;

/**
 * Telemetry batch. {@code payload} accepts either a single string holding newline-separated lines
 * or an array of strings.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TelemetryBatchRequest {

    @NotNull(message = "payload is required")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> payload;

    /**
     * Returns the individual non-blank lines of the payload, in order.
     */
    @JsonIgnore
    public List<String> lines() {
        if (payload == null) {
            return List.of();
        }
        return payload.stream()
            .filter(Objects::nonNull)
            .flatMap(String::lines)
            .filter(line -> !line.isBlank())
            .toList();
    }
}
