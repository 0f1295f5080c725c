package com.aircontrol.scheduler.flight;

import com.aircontrol.scheduler.phase.FlightPhase;
import com.aircontrol.scheduler.runway.RunwayId;
import java.util.Set;

/** Consistent copy of a flight and its aircraft, taken under the flight lock. */
public record FlightSnapshot(
    String flightId,
    String flightNumber,
    String aircraftId,
    String airlineName,
    AircraftCategory category,
    Direction direction,
    FlightStatus status,
    FlightPhase phase,
    double speed,
    double minAllowedSpeed,
    double maxAllowedSpeed,
    RunwayId assignedRunway,
    double scheduledTime,
    Double activationTime,
    double estimatedCompletionTime,
    Double delaySeconds,
    String statusReason,
    boolean groundFault,
    Set<FlightPhase> flaggedPhases) {}
