package com.aircontrol.scheduler.runway;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A single runway with exclusive occupancy.
 *
 * <p>The occupant is held by aircraft id only. Every mutator runs under the runway's own lock and
 * keeps {@code occupant != null <=> status == IN_USE}. Usage time is measured in simulation
 * seconds.
 */
public class Runway {
  private final RunwayId id;
  private final ReentrantLock lock = new ReentrantLock();
  private RunwayStatus status = RunwayStatus.AVAILABLE;
  private String occupantId;
  private double assignedAt;
  private long usageCount;
  private double usageSeconds;

  public Runway(RunwayId id) {
    this.id = id;
  }

  public RunwayId id() {
    return id;
  }

  public RunwayStatus status() {
    lock.lock();
    try {
      return status;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Claims the runway for {@code aircraftId} if it is AVAILABLE.
   *
   * @param aircraftId aircraft taking the runway
   * @param now simulation seconds, start of the usage interval
   * @return false when the runway is occupied or closed
   */
  public boolean tryAssign(String aircraftId, double now) {
    lock.lock();
    try {
      if (status != RunwayStatus.AVAILABLE) {
        return false;
      }
      occupantId = aircraftId;
      status = RunwayStatus.IN_USE;
      assignedAt = now;
      usageCount++;
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Frees the runway and adds the occupied interval to its usage.
   *
   * @param aircraftId aircraft giving the runway back
   * @param now simulation seconds, end of the usage interval
   * @return false when {@code aircraftId} is not the current occupant
   */
  public boolean release(String aircraftId, double now) {
    lock.lock();
    try {
      if (occupantId == null || !occupantId.equals(aircraftId)) {
        return false;
      }
      recordUsage(now);
      occupantId = null;
      status = RunwayStatus.AVAILABLE;
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Closes the runway, evicting any occupant after recording its usage.
   *
   * @param closedStatus MAINTENANCE or WEATHER_CLOSED
   * @param now simulation seconds
   * @return id of the evicted aircraft, if there was one
   */
  public Optional<String> close(RunwayStatus closedStatus, double now) {
    if (!closedStatus.isClosed()) {
      throw new IllegalArgumentException("Not a closed status: " + closedStatus);
    }
    lock.lock();
    try {
      String evicted = occupantId;
      if (evicted != null) {
        recordUsage(now);
        occupantId = null;
      }
      status = closedStatus;
      return Optional.ofNullable(evicted);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns a closed runway to service.
   *
   * @return false when the runway was not closed
   */
  public boolean reopen() {
    lock.lock();
    try {
      if (!status.isClosed()) {
        return false;
      }
      status = RunwayStatus.AVAILABLE;
      return true;
    } finally {
      lock.unlock();
    }
  }

  public RunwaySnapshot snapshot() {
    lock.lock();
    try {
      return new RunwaySnapshot(id, status, occupantId, usageCount, usageSeconds);
    } finally {
      lock.unlock();
    }
  }

  private void recordUsage(double now) {
    usageSeconds += Math.max(0.0, now - assignedAt);
  }
}
