package com.aircontrol.scheduler.scheduler;

/** Simulation time in seconds, advanced only by the orchestrator. */
public class SimulationClock {
  private double seconds;

  public synchronized double now() {
    return seconds;
  }

  /**
   * Moves time forward.
   *
   * @param delta non-negative seconds
   * @return the new time
   */
  public synchronized double advance(double delta) {
    if (delta < 0) {
      throw new IllegalArgumentException("Clock cannot move backwards: " + delta);
    }
    seconds += delta;
    return seconds;
  }
}
