package com.aircontrol.scheduler.flight;

/** Operational category of an aircraft; drives runway eligibility, priority and fines. */
public enum AircraftCategory {
  COMMERCIAL,
  CARGO,
  EMERGENCY;

  /** Lower values are served first when several flights contend for runways in one tick. */
  public int priority() {
    return switch (this) {
      case EMERGENCY -> 0;
      case CARGO -> 1;
      case COMMERCIAL -> 2;
    };
  }
}
