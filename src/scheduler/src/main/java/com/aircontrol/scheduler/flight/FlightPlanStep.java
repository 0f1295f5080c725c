package com.aircontrol.scheduler.flight;

import com.aircontrol.scheduler.phase.FlightPhase;

/**
 * One step of a flight plan.
 *
 * @param operation what to do
 * @param targetPhase phase entered by ADVANCE steps, {@code null} for COMPLETE
 * @param offsetSeconds simulation seconds after activation at which the step fires
 */
public record FlightPlanStep(PlanOperation operation, FlightPhase targetPhase, double offsetSeconds) {}
