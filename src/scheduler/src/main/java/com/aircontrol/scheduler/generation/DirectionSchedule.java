package com.aircontrol.scheduler.generation;

/**
 * Generation cadence for one direction.
 *
 * @param intervalSeconds simulation seconds between two generated flights
 * @param emergencyProbability chance that a generated flight is an emergency
 */
public record DirectionSchedule(double intervalSeconds, double emergencyProbability) {
  public DirectionSchedule {
    if (intervalSeconds <= 0) {
      throw new IllegalArgumentException("interval-seconds must be positive");
    }
    if (emergencyProbability < 0.0 || emergencyProbability > 1.0) {
      throw new IllegalArgumentException("emergency-probability must be within [0, 1]");
    }
  }
}
