package com.aircontrol.scheduler.generation;

import com.aircontrol.scheduler.flight.AircraftCategory;
import com.aircontrol.scheduler.flight.Airline;
import com.aircontrol.scheduler.flight.AirlineRoster;
import com.aircontrol.scheduler.flight.Direction;
import com.aircontrol.scheduler.flight.Flight;
import com.aircontrol.scheduler.flight.FlightFactory;
import com.aircontrol.scheduler.flight.FlightRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates SCHEDULED flights per direction on independent intervals.
 *
 * <p>A direction whose interval elapsed picks a random airline with spare fleet capacity. If none
 * has capacity the direction is skipped and tried again on the next cycle.
 */
public class FlightGenerator {
  private static final Logger log = LoggerFactory.getLogger(FlightGenerator.class);

  private final AirlineRoster roster;
  private final FlightFactory factory;
  private final FlightRegistry registry;
  private final Map<Direction, DirectionSchedule> schedules;
  private final Random random;
  private final Map<Direction, Double> lastGeneratedAt = new EnumMap<>(Direction.class);

  public FlightGenerator(
      AirlineRoster roster,
      FlightFactory factory,
      FlightRegistry registry,
      Map<Direction, DirectionSchedule> schedules,
      Random random) {
    for (Direction direction : Direction.values()) {
      if (!schedules.containsKey(direction)) {
        throw new IllegalArgumentException("scheduler.directions." + direction + " is missing");
      }
      lastGeneratedAt.put(direction, 0.0);
    }
    this.roster = roster;
    this.factory = factory;
    this.registry = registry;
    this.schedules = new EnumMap<>(schedules);
    this.random = random;
  }

  /** Generates the flights due at {@code now}, at most one per direction. */
  public synchronized List<Flight> generate(double now) {
    List<Flight> created = new ArrayList<>();
    for (Direction direction : Direction.values()) {
      DirectionSchedule schedule = schedules.get(direction);
      if (now - lastGeneratedAt.get(direction) < schedule.intervalSeconds()) {
        continue;
      }
      Optional<Airline> airline = reserveAirline(roster.withCapacity());
      if (airline.isEmpty()) {
        log.debug("No airline capacity for {} at t={}", direction, now);
        continue;
      }
      AircraftCategory category = random.nextDouble() < schedule.emergencyProbability()
          ? AircraftCategory.EMERGENCY
          : airline.get().primaryCategory();
      Flight flight = factory.create(airline.get(), category, direction, now);
      registry.register(flight);
      lastGeneratedAt.put(direction, now);
      created.add(flight);
      log.info("Generated {} {} {} for {}", flight.id(), category, direction, airline.get().name());
    }
    return created;
  }

  /**
   * Creates one cargo flight for the cargo-presence rule, preferring a cargo airline and falling back
   * to any airline with capacity.
   */
  public Optional<Flight> synthesizeCargoFlight(double now) {
    Optional<Airline> airline = reserveAirline(roster.withCapacity(AircraftCategory.CARGO));
    if (airline.isEmpty()) {
      airline = reserveAirline(roster.withCapacity());
    }
    if (airline.isEmpty()) {
      return Optional.empty();
    }
    Flight flight = factory.create(airline.get(), AircraftCategory.CARGO, randomDirection(), now);
    registry.register(flight);
    log.info("Synthesized cargo flight {} for {}", flight.id(), airline.get().name());
    return Optional.of(flight);
  }

  /**
   * Registers each airline's initial flights, scheduled {@code spacingSeconds} apart starting at
   * {@code start}.
   */
  public List<Flight> seedInitialFlights(double start, double spacingSeconds) {
    List<Flight> seeded = new ArrayList<>();
    double scheduledAt = start;
    for (Airline airline : roster.all()) {
      for (int i = 0; i < airline.initialActiveFlights(); i++) {
        if (!airline.tryReserve()) {
          log.debug("Seeding stopped for {}: fleet full", airline.name());
          break;
        }
        Flight flight = factory.create(
            airline, airline.primaryCategory(), randomDirection(), scheduledAt);
        registry.register(flight);
        seeded.add(flight);
        scheduledAt += spacingSeconds;
      }
    }
    log.info("Seeded {} initial flights", seeded.size());
    return seeded;
  }

  private Optional<Airline> reserveAirline(List<Airline> candidates) {
    List<Airline> remaining = new ArrayList<>(candidates);
    while (!remaining.isEmpty()) {
      Airline pick = remaining.remove(random.nextInt(remaining.size()));
      if (pick.tryReserve()) {
        return Optional.of(pick);
      }
    }
    return Optional.empty();
  }

  private Direction randomDirection() {
    Direction[] values = Direction.values();
    return values[random.nextInt(values.length)];
  }
}
