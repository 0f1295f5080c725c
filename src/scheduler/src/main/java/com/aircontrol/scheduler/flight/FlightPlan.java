package com.aircontrol.scheduler.flight;

import com.aircontrol.scheduler.phase.FlightPhase;
import java.util.List;

/**
 * Ordered, immutable list of plan steps built once when a flight is created.
 *
 * <p>Arrival and departure plans share the same shape; emergency plans run on half the offsets.
 */
public final class FlightPlan {
  private static final double EMERGENCY_FACTOR = 0.5;

  private final List<FlightPlanStep> steps;

  public FlightPlan(List<FlightPlanStep> steps) {
    if (steps.isEmpty()) {
      throw new IllegalArgumentException("Flight plan needs at least one step");
    }
    double previous = 0.0;
    for (FlightPlanStep step : steps) {
      if (step.offsetSeconds() < previous) {
        throw new IllegalArgumentException("Plan offsets must not decrease: " + steps);
      }
      previous = step.offsetSeconds();
    }
    if (steps.get(steps.size() - 1).operation() != PlanOperation.COMPLETE) {
      throw new IllegalArgumentException("Flight plan must end with COMPLETE");
    }
    this.steps = List.copyOf(steps);
  }

  public static FlightPlan forFlight(Direction direction, AircraftCategory category) {
    double factor = category == AircraftCategory.EMERGENCY ? EMERGENCY_FACTOR : 1.0;
    return direction.isArrival() ? arrival(factor) : departure(factor);
  }

  static FlightPlan arrival(double factor) {
    return new FlightPlan(List.of(
        new FlightPlanStep(PlanOperation.ADVANCE, FlightPhase.APPROACH, 30 * factor),
        new FlightPlanStep(PlanOperation.ADVANCE, FlightPhase.LANDING, 60 * factor),
        new FlightPlanStep(PlanOperation.ADVANCE_AND_RELEASE, FlightPhase.TAXI_IN, 90 * factor),
        new FlightPlanStep(PlanOperation.ADVANCE, FlightPhase.AT_GATE_ARRIVAL, 120 * factor),
        new FlightPlanStep(PlanOperation.COMPLETE, null, 150 * factor)));
  }

  static FlightPlan departure(double factor) {
    return new FlightPlan(List.of(
        new FlightPlanStep(PlanOperation.ADVANCE, FlightPhase.TAXI_OUT, 30 * factor),
        new FlightPlanStep(PlanOperation.ADVANCE, FlightPhase.TAKEOFF_ROLL, 60 * factor),
        new FlightPlanStep(PlanOperation.ADVANCE, FlightPhase.CLIMB, 75 * factor),
        new FlightPlanStep(PlanOperation.ADVANCE_AND_RELEASE, FlightPhase.CRUISE, 90 * factor),
        new FlightPlanStep(PlanOperation.COMPLETE, null, 120 * factor)));
  }

  public List<FlightPlanStep> steps() {
    return steps;
  }

  public int size() {
    return steps.size();
  }

  public FlightPlanStep step(int index) {
    return steps.get(index);
  }

  /** Offset of the final step, i.e. planned time from activation to completion. */
  public double totalSeconds() {
    return steps.get(steps.size() - 1).offsetSeconds();
  }
}
