package com.aircontrol.scheduler.phase;

/**
 * Closed speed interval {@code [min, max]} in km/h permitted for one phase.
 *
 * @param min lowest compliant speed
 * @param max highest compliant speed
 */
public record SpeedEnvelope(double min, double max) {
  public SpeedEnvelope {
    if (min < 0 || max < min) {
      throw new IllegalArgumentException("Invalid speed envelope [" + min + ", " + max + "]");
    }
  }

  public boolean contains(double speed) {
    return speed >= min && speed <= max;
  }

  /** Distance from the envelope, zero when {@code speed} is compliant. */
  public double deviation(double speed) {
    if (speed > max) {
      return speed - max;
    }
    if (speed < min) {
      return min - speed;
    }
    return 0.0;
  }
}
