package com.aircontrol.scheduler.billing;

import com.aircontrol.scheduler.flight.AircraftCategory;

/**
 * Violation details handed to the {@link NoticeIssuer}.
 *
 * @param simulationTime simulation seconds at which the violation was detected
 */
public record NoticeRequest(
    String aircraftId,
    String airlineName,
    String flightNumber,
    AircraftCategory category,
    double recordedSpeed,
    double minAllowedSpeed,
    double maxAllowedSpeed,
    double simulationTime) {}
