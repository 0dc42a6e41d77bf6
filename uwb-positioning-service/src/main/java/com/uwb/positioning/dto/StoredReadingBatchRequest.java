package com.uwb.positioning.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Batch of stored readings to run through the position solver.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StoredReadingBatchRequest {

    @NotNull(message = "readings is required")
    private List<StoredReading> readings;
}
