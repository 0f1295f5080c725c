package com.aircontrol.scheduler.billing;

import com.aircontrol.scheduler.flight.AircraftCategory;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * An airspace violation notice (AVN) with its fine and payment state.
 *
 * <p>Immutable; status changes produce a new instance.
 */
public record Notice(
    String id,
    String aircraftId,
    String airlineName,
    String flightNumber,
    AircraftCategory category,
    double recordedSpeed,
    double minAllowedSpeed,
    double maxAllowedSpeed,
    double simulationTime,
    BigDecimal fineAmount,
    BigDecimal serviceFee,
    BigDecimal totalDue,
    Instant issuedAt,
    Instant dueAt,
    NoticeStatus status,
    BigDecimal amountPaid,
    Instant paidAt) {

  Notice paid(BigDecimal amount, Instant when) {
    return new Notice(id, aircraftId, airlineName, flightNumber, category, recordedSpeed,
        minAllowedSpeed, maxAllowedSpeed, simulationTime, fineAmount, serviceFee, totalDue,
        issuedAt, dueAt, NoticeStatus.PAID, amount, when);
  }

  Notice overdue() {
    return new Notice(id, aircraftId, airlineName, flightNumber, category, recordedSpeed,
        minAllowedSpeed, maxAllowedSpeed, simulationTime, fineAmount, serviceFee, totalDue,
        issuedAt, dueAt, NoticeStatus.OVERDUE, amountPaid, paidAt);
  }
}
