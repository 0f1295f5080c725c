package com.aircontrol.scheduler.flight;

import com.aircontrol.scheduler.phase.PhaseStateMachine;
import com.aircontrol.scheduler.phase.SpeedEnvelopeTable;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds flights with sequential identifiers.
 *
 * <p>The caller must already hold a fleet slot on the airline.
 */
public class FlightFactory {
  private final SpeedEnvelopeTable envelopes;
  private final Random random;
  private final AtomicInteger sequence = new AtomicInteger(1000);

  public FlightFactory(SpeedEnvelopeTable envelopes, Random random) {
    this.envelopes = envelopes;
    this.random = random;
  }

  public Flight create(
      Airline airline, AircraftCategory category, Direction direction, double scheduledTime) {
    int number = sequence.getAndIncrement();
    String flightNumber = airline.code() + number;
    Aircraft aircraft = new Aircraft(
        airline.code() + "-AC" + number,
        airline.name(),
        flightNumber,
        category,
        direction,
        new PhaseStateMachine(direction.phaseSequence(), envelopes, random));
    return new Flight(
        "FL-" + number,
        aircraft,
        airline,
        FlightPlan.forFlight(direction, category),
        scheduledTime);
  }
}
