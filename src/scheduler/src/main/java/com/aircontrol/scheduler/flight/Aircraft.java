package com.aircontrol.scheduler.flight;

import com.aircontrol.scheduler.phase.FlightPhase;
import com.aircontrol.scheduler.phase.PhaseStateMachine;
import com.aircontrol.scheduler.runway.RunwayId;
import java.util.EnumSet;
import java.util.Set;

/**
 * The aircraft flown by one {@link Flight}.
 *
 * <p>Identity, category and direction are fixed at creation. Everything else is mutated only while
 * the owning flight's lock is held.
 */
public class Aircraft {
  private final String id;
  private final String airlineName;
  private final String flightNumber;
  private final AircraftCategory category;
  private final Direction direction;
  private final PhaseStateMachine phaseMachine;
  private final EnumSet<FlightPhase> flaggedPhases = EnumSet.noneOf(FlightPhase.class);
  private RunwayId assignedRunway;
  private boolean groundFault;

  public Aircraft(
      String id,
      String airlineName,
      String flightNumber,
      AircraftCategory category,
      Direction direction,
      PhaseStateMachine phaseMachine) {
    this.id = id;
    this.airlineName = airlineName;
    this.flightNumber = flightNumber;
    this.category = category;
    this.direction = direction;
    this.phaseMachine = phaseMachine;
  }

  public String id() {
    return id;
  }

  public String airlineName() {
    return airlineName;
  }

  public String flightNumber() {
    return flightNumber;
  }

  public AircraftCategory category() {
    return category;
  }

  public Direction direction() {
    return direction;
  }

  public PhaseStateMachine phaseMachine() {
    return phaseMachine;
  }

  public FlightPhase phase() {
    return phaseMachine.phase();
  }

  public double speed() {
    return phaseMachine.speed();
  }

  public RunwayId assignedRunway() {
    return assignedRunway;
  }

  public void assignRunway(RunwayId runway) {
    this.assignedRunway = runway;
  }

  public void clearRunway() {
    this.assignedRunway = null;
  }

  /** Records a violation for {@code phase}; false if that phase was already flagged. */
  public boolean flagViolation(FlightPhase phase) {
    return flaggedPhases.add(phase);
  }

  public Set<FlightPhase> flaggedPhases() {
    return EnumSet.copyOf(flaggedPhases);
  }

  public boolean hasGroundFault() {
    return groundFault;
  }

  public void markGroundFault() {
    this.groundFault = true;
  }
}
