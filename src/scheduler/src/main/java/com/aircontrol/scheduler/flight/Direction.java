package com.aircontrol.scheduler.flight;

import com.aircontrol.scheduler.phase.PhaseSequence;

/**
 * Cardinal direction a flight is bound to.
 *
 * <p>NORTH and SOUTH traffic arrives, EAST and WEST traffic departs.
 */
public enum Direction {
  NORTH,
  SOUTH,
  EAST,
  WEST;

  public boolean isArrival() {
    return this == NORTH || this == SOUTH;
  }

  public PhaseSequence phaseSequence() {
    return isArrival() ? PhaseSequence.ARRIVAL : PhaseSequence.DEPARTURE;
  }
}
