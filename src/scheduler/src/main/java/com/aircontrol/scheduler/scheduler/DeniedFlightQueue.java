package com.aircontrol.scheduler.scheduler;

import com.aircontrol.scheduler.flight.Flight;
import com.aircontrol.scheduler.flight.FlightStatus;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Predicate;

/**
 * FIFO of flights refused a runway.
 *
 * <p>A flight is queued at most once. Draining is bounded per call; flights that still fail go to
 * the back of the queue, flights that are no longer SCHEDULED are dropped.
 */
public class DeniedFlightQueue {
  private final ConcurrentLinkedQueue<Flight> queue = new ConcurrentLinkedQueue<>();
  private final Set<String> queuedIds = ConcurrentHashMap.newKeySet();

  /** Queues {@code flight}; false if it is already waiting. */
  public boolean offer(Flight flight) {
    if (!queuedIds.add(flight.id())) {
      return false;
    }
    queue.add(flight);
    return true;
  }

  /**
   * Takes a flight out of the queue after it obtained a runway elsewhere.
   *
   * @param flightId id of the flight
   * @return false when the flight was not queued
   */
  public boolean remove(String flightId) {
    if (!queuedIds.remove(flightId)) {
      return false;
    }
    queue.removeIf(flight -> flight.id().equals(flightId));
    return true;
  }

  public boolean contains(String flightId) {
    return queuedIds.contains(flightId);
  }

  public int size() {
    return queuedIds.size();
  }

  public List<String> ids() {
    List<String> ids = new ArrayList<>();
    for (Flight flight : queue) {
      ids.add(flight.id());
    }
    return ids;
  }

  /**
   * Retries up to {@code budget} queued flights with {@code attempt}.
   *
   * @param attempt returns true when the flight obtained a runway
   */
  public DrainResult drain(int budget, Predicate<Flight> attempt) {
    int attempted = 0;
    int assigned = 0;
    int dropped = 0;
    List<Flight> retry = new ArrayList<>();
    while (attempted + dropped < budget) {
      Flight flight = queue.poll();
      if (flight == null) {
        break;
      }
      if (flight.status() != FlightStatus.SCHEDULED) {
        queuedIds.remove(flight.id());
        dropped++;
        continue;
      }
      attempted++;
      if (attempt.test(flight)) {
        queuedIds.remove(flight.id());
        assigned++;
      } else {
        retry.add(flight);
      }
    }
    queue.addAll(retry);
    return new DrainResult(attempted, assigned, retry.size(), dropped);
  }

  /** Outcome of one drain. */
  public record DrainResult(int attempted, int assigned, int requeued, int dropped) {}
}
