package com.aircontrol.scheduler.scheduler;

import static com.aircontrol.scheduler.TrafficFixtures.flight;
import static org.assertj.core.api.Assertions.assertThat;

import com.aircontrol.scheduler.flight.AircraftCategory;
import com.aircontrol.scheduler.flight.Direction;
import com.aircontrol.scheduler.flight.Flight;
import com.aircontrol.scheduler.runway.RunwayPool;
import org.junit.jupiter.api.Test;

class DeniedFlightQueueTest {

  private final DeniedFlightQueue queue = new DeniedFlightQueue();

  @Test
  void flightIsQueuedOnlyOnce() {
    Flight flight = flight(AircraftCategory.COMMERCIAL, Direction.NORTH);

    assertThat(queue.offer(flight)).isTrue();
    assertThat(queue.offer(flight)).isFalse();
    assertThat(queue.size()).isEqualTo(1);
    assertThat(queue.contains(flight.id())).isTrue();
  }

  @Test
  void removedFlightIsNotRetried() {
    Flight first = flight(AircraftCategory.COMMERCIAL, Direction.NORTH);
    Flight second = flight(AircraftCategory.COMMERCIAL, Direction.SOUTH);
    queue.offer(first);
    queue.offer(second);

    assertThat(queue.remove(first.id())).isTrue();
    assertThat(queue.remove(first.id())).isFalse();

    assertThat(queue.ids()).containsExactly(second.id());
    assertThat(queue.size()).isEqualTo(1);
    DeniedFlightQueue.DrainResult result = queue.drain(5, flight -> true);
    assertThat(result).isEqualTo(new DeniedFlightQueue.DrainResult(1, 1, 0, 0));
    assertThat(queue.offer(first)).isTrue();
  }

  @Test
  void drainIsBoundedAndRequeuesFailuresAtTheBack() {
    Flight first = flight(AircraftCategory.COMMERCIAL, Direction.NORTH);
    Flight second = flight(AircraftCategory.COMMERCIAL, Direction.SOUTH);
    Flight third = flight(AircraftCategory.COMMERCIAL, Direction.EAST);
    queue.offer(first);
    queue.offer(second);
    queue.offer(third);

    DeniedFlightQueue.DrainResult result = queue.drain(2, flight -> flight == second);

    assertThat(result).isEqualTo(new DeniedFlightQueue.DrainResult(2, 1, 1, 0));
    assertThat(queue.ids()).containsExactly(third.id(), first.id());
    assertThat(queue.contains(second.id())).isFalse();
  }

  @Test
  void flightsNoLongerScheduledAreDroppedAndCountAgainstBudget() {
    Flight canceled = flight(AircraftCategory.COMMERCIAL, Direction.NORTH);
    Flight waiting = flight(AircraftCategory.COMMERCIAL, Direction.SOUTH);
    queue.offer(canceled);
    queue.offer(waiting);
    canceled.cancel("test", 0.0, new RunwayPool(false));

    DeniedFlightQueue.DrainResult result = queue.drain(1, flight -> true);

    assertThat(result.dropped()).isEqualTo(1);
    assertThat(result.attempted()).isZero();
    assertThat(queue.ids()).containsExactly(waiting.id());
  }
}
