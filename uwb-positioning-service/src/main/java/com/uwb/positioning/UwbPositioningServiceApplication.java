package com.uwb.positioning;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the UWB Positioning Service.
 *
 * <p>Accepts line-oriented telemetry from UWB ranging anchors, stores calibrated distance
 * readings, resolves 2D tag positions by multilateration and tracks per-user report sessions
 * opened and closed by inline command codes.
 */
@SpringBootApplication
public class UwbPositioningServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(UwbPositioningServiceApplication.class, args);
  }
}
