package com.aircontrol.scheduler.runway;

import com.aircontrol.scheduler.flight.AircraftCategory;
import com.aircontrol.scheduler.flight.Direction;

/** The three runways and their fixed eligibility rules. */
public enum RunwayId {
  /** Arrivals (NORTH/SOUTH) only. */
  RWY_A,
  /** Departures (EAST/WEST) only. */
  RWY_B,
  /** Any direction, reserved for cargo and emergency traffic. */
  RWY_C;

  public boolean servesDirection(Direction direction) {
    return switch (this) {
      case RWY_A -> direction.isArrival();
      case RWY_B -> !direction.isArrival();
      case RWY_C -> true;
    };
  }

  /** Category rule without overflow; commercial use of RWY_C is decided by the pool. */
  public boolean acceptsCategory(AircraftCategory category) {
    return this != RWY_C || category != AircraftCategory.COMMERCIAL;
  }

  /** Runway matched to a direction for ordinary traffic. */
  public static RunwayId primaryFor(Direction direction) {
    return direction.isArrival() ? RWY_A : RWY_B;
  }
}
