package com.aircontrol.scheduler.runway;

import com.aircontrol.scheduler.flight.Aircraft;
import com.aircontrol.scheduler.flight.AircraftCategory;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed set of runways and the eligibility rules for claiming them.
 *
 * <p>Calls that take an {@link Aircraft} must be made while holding the owning flight's lock: the
 * pool writes the assigned runway back onto the aircraft. The pool never takes a flight lock itself,
 * so the lock order is always flight first, runway second.
 */
public class RunwayPool {
  private final Map<RunwayId, Runway> runways = new EnumMap<>(RunwayId.class);
  private final boolean allowCommercialOverflow;

  public RunwayPool(boolean allowCommercialOverflow) {
    this.allowCommercialOverflow = allowCommercialOverflow;
    for (RunwayId id : RunwayId.values()) {
      runways.put(id, new Runway(id));
    }
  }

  public boolean allowsCommercialOverflow() {
    return allowCommercialOverflow;
  }

  public Runway runway(RunwayId id) {
    return runways.get(id);
  }

  /**
   * Tries to put {@code aircraft} on runway {@code id}.
   *
   * <p>Fails when the aircraft already holds a runway, when the runway is not AVAILABLE, or when the
   * direction or category rule rejects it. A commercial aircraft gets RWY_C only when overflow is
   * enabled and its primary runway is not AVAILABLE.
   */
  public boolean tryAssign(Aircraft aircraft, RunwayId id, double now) {
    if (aircraft.assignedRunway() != null) {
      return false;
    }
    if (!isEligible(aircraft, id)) {
      return false;
    }
    if (!runways.get(id).tryAssign(aircraft.id(), now)) {
      return false;
    }
    aircraft.assignRunway(id);
    return true;
  }

  /**
   * Releases whatever runway {@code aircraft} holds and clears it from the aircraft.
   *
   * @return false when the aircraft held nothing or had already been evicted
   */
  public boolean release(Aircraft aircraft, double now) {
    RunwayId held = aircraft.assignedRunway();
    if (held == null) {
      return false;
    }
    aircraft.clearRunway();
    return runways.get(held).release(aircraft.id(), now);
  }

  /**
   * Closes a runway.
   *
   * @param id runway to close
   * @param status closed status to apply
   * @param now simulation seconds
   * @return id of the evicted occupant, if any
   */
  public Optional<String> close(RunwayId id, RunwayStatus status, double now) {
    return runways.get(id).close(status, now);
  }

  /**
   * Reopens a closed runway.
   *
   * @param id runway to reopen
   * @return false when the runway was not closed
   */
  public boolean reopen(RunwayId id) {
    return runways.get(id).reopen();
  }

  public List<RunwaySnapshot> snapshot() {
    List<RunwaySnapshot> snapshots = new ArrayList<>(runways.size());
    for (Runway runway : runways.values()) {
      snapshots.add(runway.snapshot());
    }
    return snapshots;
  }

  private boolean isEligible(Aircraft aircraft, RunwayId id) {
    if (!id.servesDirection(aircraft.direction())) {
      return false;
    }
    if (id.acceptsCategory(aircraft.category())) {
      return true;
    }
    // Only COMMERCIAL on RWY_C reaches this point.
    return allowCommercialOverflow
        && aircraft.category() == AircraftCategory.COMMERCIAL
        && runways.get(RunwayId.primaryFor(aircraft.direction())).status()
            != RunwayStatus.AVAILABLE;
  }
}
