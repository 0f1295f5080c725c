package com.aircontrol.scheduler.phase;

import java.util.List;

/**
 * The two fixed phase orders. An aircraft carries exactly one of them for its whole life,
 * chosen from its direction.
 */
public enum PhaseSequence {
  ARRIVAL(List.of(
      FlightPhase.HOLDING,
      FlightPhase.APPROACH,
      FlightPhase.LANDING,
      FlightPhase.TAXI_IN,
      FlightPhase.AT_GATE_ARRIVAL)),
  DEPARTURE(List.of(
      FlightPhase.AT_GATE_DEPARTURE,
      FlightPhase.TAXI_OUT,
      FlightPhase.TAKEOFF_ROLL,
      FlightPhase.CLIMB,
      FlightPhase.CRUISE));

  private final List<FlightPhase> phases;

  PhaseSequence(List<FlightPhase> phases) {
    this.phases = phases;
  }

  public List<FlightPhase> phases() {
    return phases;
  }

  public FlightPhase initialPhase() {
    return phases.get(0);
  }

  public FlightPhase terminalPhase() {
    return phases.get(phases.size() - 1);
  }

  public boolean contains(FlightPhase phase) {
    return phases.contains(phase);
  }

  public boolean isTerminal(FlightPhase phase) {
    return terminalPhase() == phase;
  }

  /**
   * Returns the phase following {@code phase}.
   *
   * @throws InvalidTransitionException when {@code phase} is terminal or not part of this sequence
   */
  public FlightPhase next(FlightPhase phase) {
    int index = phases.indexOf(phase);
    if (index < 0) {
      throw new InvalidTransitionException(
          "Phase " + phase + " is not part of the " + name() + " sequence");
    }
    if (index == phases.size() - 1) {
      throw new InvalidTransitionException("Phase " + phase + " is terminal for " + name());
    }
    return phases.get(index + 1);
  }
}
