package com.aircontrol.scheduler.flight;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Authoritative collection of flights in registration order.
 *
 * <p>The registry lock covers structural changes only. Readers get copies and inspect flights after
 * the lock is released, so no flight or runway lock is ever taken under it.
 */
public class FlightRegistry {
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, Flight> flights = new LinkedHashMap<>();

  public void register(Flight flight) {
    lock.writeLock().lock();
    try {
      if (flights.putIfAbsent(flight.id(), flight) != null) {
        throw new IllegalArgumentException("Flight already registered: " + flight.id());
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  public Optional<Flight> find(String flightId) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(flights.get(flightId));
    } finally {
      lock.readLock().unlock();
    }
  }

  public Optional<Flight> findByAircraft(String aircraftId) {
    return snapshot().stream()
        .filter(flight -> flight.aircraftId().equals(aircraftId))
        .findFirst();
  }

  public List<Flight> snapshot() {
    lock.readLock().lock();
    try {
      return new ArrayList<>(flights.values());
    } finally {
      lock.readLock().unlock();
    }
  }

  public List<Flight> byStatus(FlightStatus status) {
    return snapshot().stream()
        .filter(flight -> flight.status() == status)
        .collect(Collectors.toList());
  }

  public List<Flight> airborne() {
    return snapshot().stream()
        .filter(flight -> flight.status().isAirborne())
        .collect(Collectors.toList());
  }

  /** Non-terminal flights of {@code category}, scheduled ones included. */
  public int countLive(AircraftCategory category) {
    int count = 0;
    for (Flight flight : snapshot()) {
      if (flight.category() == category && !flight.status().isTerminal()) {
        count++;
      }
    }
    return count;
  }

  public int size() {
    lock.readLock().lock();
    try {
      return flights.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Removes terminal flights that went terminal at or before {@code cutoff}.
   *
   * @return the removed flights
   */
  public List<Flight> purgeTerminalBefore(double cutoff) {
    List<Flight> candidates = new ArrayList<>();
    for (Flight flight : snapshot()) {
      Double terminalAt = flight.terminalTime();
      if (terminalAt != null && terminalAt <= cutoff) {
        candidates.add(flight);
      }
    }
    if (candidates.isEmpty()) {
      return candidates;
    }
    lock.writeLock().lock();
    try {
      Iterator<Flight> iterator = candidates.iterator();
      while (iterator.hasNext()) {
        if (flights.remove(iterator.next().id()) == null) {
          iterator.remove();
        }
      }
    } finally {
      lock.writeLock().unlock();
    }
    return candidates;
  }
}
