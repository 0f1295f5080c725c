package com.aircontrol.scheduler.phase;

/** Every phase an aircraft can be in, arrivals first, then departures. */
public enum FlightPhase {
  HOLDING,
  APPROACH,
  LANDING,
  TAXI_IN,
  AT_GATE_ARRIVAL,

  AT_GATE_DEPARTURE,
  TAXI_OUT,
  TAKEOFF_ROLL,
  CLIMB,
  CRUISE;

  /** Phases spent on the ground, the only ones in which ground faults can occur. */
  public boolean isGroundPhase() {
    return this == TAXI_IN
        || this == AT_GATE_ARRIVAL
        || this == AT_GATE_DEPARTURE
        || this == TAXI_OUT;
  }
}
