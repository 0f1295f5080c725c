package com.aircontrol.scheduler.runway;

import com.aircontrol.scheduler.flight.AircraftCategory;
import com.aircontrol.scheduler.flight.Direction;
import java.util.ArrayList;
import java.util.List;

/**
 * Orders the runways an aircraft should try, by category.
 *
 * <ul>
 *   <li>EMERGENCY: every runway serving its direction, in A, B, C order</li>
 *   <li>CARGO: RWY_C first, then its primary runway</li>
 *   <li>COMMERCIAL: its primary runway, then RWY_C when overflow is enabled</li>
 * </ul>
 */
public class RunwaySelector {
  private final boolean allowCommercialOverflow;

  public RunwaySelector(boolean allowCommercialOverflow) {
    this.allowCommercialOverflow = allowCommercialOverflow;
  }

  public List<RunwayId> candidates(AircraftCategory category, Direction direction) {
    List<RunwayId> order = new ArrayList<>(3);
    RunwayId primary = RunwayId.primaryFor(direction);
    switch (category) {
      case EMERGENCY -> {
        for (RunwayId id : RunwayId.values()) {
          if (id.servesDirection(direction)) {
            order.add(id);
          }
        }
      }
      case CARGO -> {
        order.add(RunwayId.RWY_C);
        order.add(primary);
      }
      case COMMERCIAL -> {
        order.add(primary);
        if (allowCommercialOverflow) {
          order.add(RunwayId.RWY_C);
        }
      }
    }
    return order;
  }
}
