package com.aircontrol.scheduler.phase;

/** How speed evolves while an aircraft stays in one phase. */
public enum SpeedProfile {
  /** Speed sampled once on entry and held. */
  CONSTANT,
  /** Linear decay from the entry speed toward the envelope floor over the phase duration. */
  DECAY,
  /** Linear ramp from the envelope floor toward the envelope ceiling over the phase duration. */
  RAMP;

  public static SpeedProfile forPhase(FlightPhase phase) {
    return switch (phase) {
      case LANDING -> DECAY;
      case TAKEOFF_ROLL -> RAMP;
      default -> CONSTANT;
    };
  }
}
