package com.aircontrol.scheduler.flight;

/**
 * Lifecycle status of a flight.
 *
 * <p>Allowed transitions:
 * <ul>
 *   <li>SCHEDULED to ACTIVE, EMERGENCY or CANCELED</li>
 *   <li>ACTIVE to COMPLETED, CANCELED, DIVERTED or EMERGENCY</li>
 *   <li>EMERGENCY to COMPLETED, CANCELED or DIVERTED</li>
 * </ul>
 * COMPLETED, CANCELED and DIVERTED are terminal.
 */
public enum FlightStatus {
  SCHEDULED,
  ACTIVE,
  EMERGENCY,
  COMPLETED,
  CANCELED,
  DIVERTED;

  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELED || this == DIVERTED;
  }

  /** ACTIVE or EMERGENCY, i.e. flying its plan. */
  public boolean isAirborne() {
    return this == ACTIVE || this == EMERGENCY;
  }

  public boolean canTransitionTo(FlightStatus target) {
    return switch (this) {
      case SCHEDULED -> target == ACTIVE || target == EMERGENCY || target == CANCELED;
      case ACTIVE -> target == COMPLETED
          || target == CANCELED
          || target == DIVERTED
          || target == EMERGENCY;
      case EMERGENCY -> target == COMPLETED || target == CANCELED || target == DIVERTED;
      case COMPLETED, CANCELED, DIVERTED -> false;
    };
  }
}
