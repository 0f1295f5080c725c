package com.aircontrol.scheduler.violation;

import com.aircontrol.scheduler.flight.Aircraft;
import com.aircontrol.scheduler.flight.AircraftCategory;
import com.aircontrol.scheduler.phase.SpeedEnvelope;
import java.util.Random;

/**
 * Occasionally pins an aircraft to an out-of-envelope speed for the rest of its current phase.
 *
 * <p>Called on activation and after every phase change, under the owning flight's lock. Emergency
 * aircraft are never touched.
 */
public class ViolationInjector {
  private final Random random;
  private final double probability;
  private final double minExcess;
  private final double maxExcess;

  public ViolationInjector(Random random, double probability, double minExcess, double maxExcess) {
    if (probability < 0.0 || probability > 1.0) {
      throw new IllegalArgumentException("scheduler.injection.probability must be within [0, 1]");
    }
    if (minExcess <= 0.0 || maxExcess < minExcess) {
      throw new IllegalArgumentException("scheduler.injection excess range is invalid");
    }
    this.random = random;
    this.probability = probability;
    this.minExcess = minExcess;
    this.maxExcess = maxExcess;
  }

  /** Returns true when a hold was applied. */
  public boolean maybeInject(Aircraft aircraft) {
    if (aircraft.category() == AircraftCategory.EMERGENCY) {
      return false;
    }
    if (probability == 0.0 || random.nextDouble() >= probability) {
      return false;
    }
    SpeedEnvelope envelope = aircraft.phaseMachine().envelope();
    double excess = minExcess + random.nextDouble() * (maxExcess - minExcess);
    boolean below = random.nextBoolean() && envelope.min() - excess >= 0.0;
    double pinned = below ? envelope.min() - excess : envelope.max() + excess;
    aircraft.phaseMachine().hold(pinned);
    return true;
  }
}
