package com.aircontrol.scheduler.model;

import com.aircontrol.scheduler.phase.FlightPhase;
import java.util.Map;

/** Response contract for {@code GET /api/violations/counts}. */
public record ViolationCountsResponse(
    Map<String, Integer> byAirline, Map<FlightPhase, Integer> byPhase, int total) {}
