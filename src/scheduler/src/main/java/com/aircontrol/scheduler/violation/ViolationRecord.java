package com.aircontrol.scheduler.violation;

import com.aircontrol.scheduler.flight.AircraftCategory;
import com.aircontrol.scheduler.phase.FlightPhase;

/**
 * Immutable record of one speed violation.
 *
 * @param timestamp simulation seconds at detection
 */
public record ViolationRecord(
    String aircraftId,
    String flightNumber,
    String airlineName,
    AircraftCategory category,
    FlightPhase phase,
    ViolationKind kind,
    double actualSpeed,
    double minAllowedSpeed,
    double maxAllowedSpeed,
    double timestamp,
    String description) {

  /** Distance of the recorded speed from the envelope, zero if it was inside. */
  public double deviation() {
    if (actualSpeed > maxAllowedSpeed) {
      return actualSpeed - maxAllowedSpeed;
    }
    if (actualSpeed < minAllowedSpeed) {
      return minAllowedSpeed - actualSpeed;
    }
    return 0.0;
  }
}
