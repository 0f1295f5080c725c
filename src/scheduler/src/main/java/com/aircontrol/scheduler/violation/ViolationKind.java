package com.aircontrol.scheduler.violation;

public enum ViolationKind {
  /** Sample outside the phase envelope. */
  OUT_OF_ENVELOPE,
  /** Mean sample-to-sample change above the erratic threshold. */
  ERRATIC
}
