package com.aircontrol.scheduler.flight;

import com.aircontrol.scheduler.phase.FlightPhase;
import com.aircontrol.scheduler.phase.SpeedEnvelope;
import com.aircontrol.scheduler.runway.RunwayId;
import com.aircontrol.scheduler.runway.RunwayPool;
import com.aircontrol.scheduler.violation.ViolationInjector;
import java.util.List;
import java.util.Random;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A scheduled movement: one aircraft, its plan and its lifecycle status.
 *
 * <p>The flight lock guards the aircraft and every field below. Methods that touch runways take the
 * runway lock while holding the flight lock, never the other way round.
 */
public class Flight {
  public static final String GROUND_FAULT_REASON = "Ground fault detected";

  private final String id;
  private final Aircraft aircraft;
  private final Airline airline;
  private final FlightPlan plan;
  private final double scheduledTime;
  private final ReentrantLock lock = new ReentrantLock();
  private volatile FlightStatus status = FlightStatus.SCHEDULED;
  private Double activationTime;
  private Double terminalTime;
  private String statusReason;
  private int cursor;

  public Flight(String id, Aircraft aircraft, Airline airline, FlightPlan plan, double scheduledTime) {
    this.id = id;
    this.aircraft = aircraft;
    this.airline = airline;
    this.plan = plan;
    this.scheduledTime = scheduledTime;
  }

  public String id() {
    return id;
  }

  public String aircraftId() {
    return aircraft.id();
  }

  public AircraftCategory category() {
    return aircraft.category();
  }

  public Direction direction() {
    return aircraft.direction();
  }

  public double scheduledTime() {
    return scheduledTime;
  }

  public FlightPlan plan() {
    return plan;
  }

  /** Latest status; may be stale by the time the caller acts on it. */
  public FlightStatus status() {
    return status;
  }

  /** Simulation time at which the flight went terminal, if it did. */
  public Double terminalTime() {
    lock.lock();
    try {
      return terminalTime;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Tries each candidate runway in order and activates the flight on the first one granted.
   *
   * @return false when the flight is not SCHEDULED or no candidate was granted
   */
  public boolean tryActivate(
      double now, RunwayPool pool, List<RunwayId> candidates, ViolationInjector injector) {
    lock.lock();
    try {
      if (status != FlightStatus.SCHEDULED) {
        return false;
      }
      for (RunwayId candidate : candidates) {
        if (pool.tryAssign(aircraft, candidate, now)) {
          FlightStatus target = aircraft.category() == AircraftCategory.EMERGENCY
              ? FlightStatus.EMERGENCY
              : FlightStatus.ACTIVE;
          transition(target);
          activationTime = now;
          cursor = 0;
          injector.maybeInject(aircraft);
          return true;
        }
      }
      return false;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Applies every plan step whose offset has elapsed, then shapes speed within the current phase.
   *
   * @return true when this call completed the flight
   */
  public boolean advancePlan(double now, RunwayPool pool, ViolationInjector injector) {
    lock.lock();
    try {
      if (!status.isAirborne()) {
        return false;
      }
      double elapsed = now - activationTime;
      while (cursor < plan.size() && elapsed >= plan.step(cursor).offsetSeconds()) {
        FlightPlanStep step = plan.step(cursor);
        cursor++;
        switch (step.operation()) {
          case ADVANCE -> {
            aircraft.phaseMachine().advanceTo(step.targetPhase());
            injector.maybeInject(aircraft);
          }
          case ADVANCE_AND_RELEASE -> {
            aircraft.phaseMachine().advanceTo(step.targetPhase());
            pool.release(aircraft, now);
            injector.maybeInject(aircraft);
          }
          case COMPLETE -> {
            finish(FlightStatus.COMPLETED, null, now, pool);
            return true;
          }
        }
      }
      double phaseStart = cursor == 0 ? 0.0 : plan.step(cursor - 1).offsetSeconds();
      double phaseEnd = plan.step(cursor).offsetSeconds();
      double span = phaseEnd - phaseStart;
      aircraft.phaseMachine().progress(span <= 0 ? 1.0 : (elapsed - phaseStart) / span);
      return false;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Cancels the flight, giving back its runway and fleet slot.
   *
   * @return false when the status graph forbids it
   */
  public boolean cancel(String reason, double now, RunwayPool pool) {
    lock.lock();
    try {
      return finish(FlightStatus.CANCELED, reason, now, pool);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Samples a ground fault for an airborne flight currently in a ground phase and cancels the
   * flight when one occurs.
   */
  public boolean checkGroundFault(Random random, double probability, double now, RunwayPool pool) {
    lock.lock();
    try {
      if (!status.isAirborne() || !aircraft.phase().isGroundPhase()) {
        return false;
      }
      if (random.nextDouble() >= probability) {
        return false;
      }
      aircraft.markGroundFault();
      return finish(FlightStatus.CANCELED, GROUND_FAULT_REASON, now, pool);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Flags a violation for {@code phase} if the aircraft is still in it and it was not flagged
   * before.
   */
  public boolean tryFlagViolation(FlightPhase phase) {
    lock.lock();
    try {
      if (aircraft.phase() != phase) {
        return false;
      }
      return aircraft.flagViolation(phase);
    } finally {
      lock.unlock();
    }
  }

  /** Drops the runway reference after the runway was closed underneath this aircraft. */
  public void onRunwayEvicted(RunwayId runway) {
    lock.lock();
    try {
      if (aircraft.assignedRunway() == runway) {
        aircraft.clearRunway();
      }
    } finally {
      lock.unlock();
    }
  }

  public FlightSnapshot snapshot() {
    lock.lock();
    try {
      SpeedEnvelope envelope = aircraft.phaseMachine().envelope();
      double base = activationTime != null ? activationTime : scheduledTime;
      return new FlightSnapshot(
          id,
          aircraft.flightNumber(),
          aircraft.id(),
          aircraft.airlineName(),
          aircraft.category(),
          aircraft.direction(),
          status,
          aircraft.phase(),
          aircraft.speed(),
          envelope.min(),
          envelope.max(),
          aircraft.assignedRunway(),
          scheduledTime,
          activationTime,
          base + plan.totalSeconds(),
          activationTime != null ? activationTime - scheduledTime : null,
          statusReason,
          aircraft.hasGroundFault(),
          aircraft.flaggedPhases());
    } finally {
      lock.unlock();
    }
  }

  private boolean finish(FlightStatus target, String reason, double now, RunwayPool pool) {
    if (!transition(target)) {
      return false;
    }
    pool.release(aircraft, now);
    airline.release();
    statusReason = reason;
    terminalTime = now;
    return true;
  }

  private boolean transition(FlightStatus target) {
    if (!status.canTransitionTo(target)) {
      return false;
    }
    status = target;
    return true;
  }
}
