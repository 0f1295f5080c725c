package com.aircontrol.scheduler.violation;

/**
 * Per-violation fee used for airline fine totals.
 *
 * @param base fee for an ordinary violation
 * @param severe fee once the deviation exceeds {@code severeDeviation}
 * @param severeDeviation km/h beyond the envelope that escalates the fee
 */
public record FineSchedule(long base, long severe, double severeDeviation) {
  public FineSchedule {
    if (base < 0 || severe < base || severeDeviation < 0) {
      throw new IllegalArgumentException("scheduler.fines values are invalid");
    }
  }

  public long feeFor(ViolationRecord record) {
    return record.deviation() > severeDeviation ? severe : base;
  }
}
