package com.uwb.positioning.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Configuration properties for the UWB positioning service.
 * Maps to the 'uwb' section in application.yml.
 */
@Data
@Component
@ConfigurationProperties(prefix = "uwb")
public class UwbProperties {

    private Calibration calibration = new Calibration();
    private Solver solver = new Solver();
    private Forwarding forwarding = new Forwarding();

    @Data
    public static class Calibration {
        /** Constant subtracted from every raw distance and span value. */
        private double offset = 40.0;
        private double sentinelTolerance = 1e-9;
        /** Tag ids that only ever produce calibration readings. */
        private Set<String> tags = new LinkedHashSet<>(Set.of("62"));
    }

    @Data
    public static class Solver {
        private double determinantEpsilon = 1e-9;
    }

    @Data
    public static class Forwarding {
        private boolean enabled = false;
        private String baseUrl = "http://localhost:8080";
        private String path = "/v1/uwb/positions/calculate";
        private long connectTimeoutMs = 300;
        private long readTimeoutMs = 2000;
    }
}
