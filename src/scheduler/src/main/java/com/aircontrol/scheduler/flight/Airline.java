package com.aircontrol.scheduler.flight;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * An operator with a hard fleet cap.
 *
 * <p>A slot is reserved when one of its flights is created and released when that flight reaches a
 * terminal status.
 */
public class Airline {
  private final String name;
  private final String code;
  private final AircraftCategory primaryCategory;
  private final int totalAircraft;
  private final int initialActiveFlights;
  private final AtomicInteger activeFleet = new AtomicInteger();

  public Airline(
      String name,
      String code,
      AircraftCategory primaryCategory,
      int totalAircraft,
      int initialActiveFlights) {
    if (totalAircraft <= 0) {
      throw new IllegalArgumentException("Airline " + name + " needs a positive fleet size");
    }
    if (initialActiveFlights < 0 || initialActiveFlights > totalAircraft) {
      throw new IllegalArgumentException(
          "Airline " + name + " initial flights must be within [0, " + totalAircraft + "]");
    }
    this.name = name;
    this.code = code;
    this.primaryCategory = primaryCategory;
    this.totalAircraft = totalAircraft;
    this.initialActiveFlights = initialActiveFlights;
  }

  public String name() {
    return name;
  }

  public String code() {
    return code;
  }

  public AircraftCategory primaryCategory() {
    return primaryCategory;
  }

  public int totalAircraft() {
    return totalAircraft;
  }

  public int initialActiveFlights() {
    return initialActiveFlights;
  }

  public int activeFleetSize() {
    return activeFleet.get();
  }

  /**
   * Checks for a free fleet slot without taking it.
   *
   * @return true when fewer flights are live than the fleet size
   */
  public boolean hasCapacity() {
    return activeFleet.get() < totalAircraft;
  }

  /**
   * Takes one fleet slot.
   *
   * @return false when the airline is at capacity
   */
  public boolean tryReserve() {
    while (true) {
      int current = activeFleet.get();
      if (current >= totalAircraft) {
        return false;
      }
      if (activeFleet.compareAndSet(current, current + 1)) {
        return true;
      }
    }
  }

  /** Gives back one fleet slot; never drops below zero. */
  public void release() {
    activeFleet.updateAndGet(current -> Math.max(0, current - 1));
  }
}
