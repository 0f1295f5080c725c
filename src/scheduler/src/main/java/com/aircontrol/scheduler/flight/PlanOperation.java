package com.aircontrol.scheduler.flight;

/** What a flight plan step does when its offset is reached. */
public enum PlanOperation {
  /** Move the aircraft into the step's target phase. */
  ADVANCE,
  /** Move into the target phase and give the runway back. */
  ADVANCE_AND_RELEASE,
  /** Mark the flight COMPLETED. */
  COMPLETE
}
