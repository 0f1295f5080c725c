package com.aircontrol.scheduler.billing;

/** Result of a payment confirmation. */
public enum PaymentOutcome {
  ACCEPTED,
  /** Amount below the total due; the notice is unchanged. */
  INSUFFICIENT,
  UNKNOWN_NOTICE,
  ALREADY_PAID
}
