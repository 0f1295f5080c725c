package com.aircontrol.scheduler.model;

import com.aircontrol.scheduler.scheduler.SimulationState;

/**
 * Response contract for {@code GET /api/simulation}.
 *
 * @param state lifecycle state
 * @param clockSeconds current simulation time
 * @param durationSeconds configured simulation length
 * @param remainingSeconds time left, never negative
 * @param totalFlights flights currently held by the registry
 * @param timestamp response generation timestamp
 */
public record SimulationStatusResponse(
    SimulationState state,
    double clockSeconds,
    double durationSeconds,
    double remainingSeconds,
    int totalFlights,
    String timestamp) {}
