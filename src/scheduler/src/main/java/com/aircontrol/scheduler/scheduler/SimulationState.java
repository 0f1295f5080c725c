package com.aircontrol.scheduler.scheduler;

/** Whole-simulation lifecycle. STOPPED and COMPLETED are final. */
public enum SimulationState {
  INITIALIZED,
  RUNNING,
  PAUSED,
  STOPPED,
  COMPLETED;

  public boolean isFinal() {
    return this == STOPPED || this == COMPLETED;
  }
}
