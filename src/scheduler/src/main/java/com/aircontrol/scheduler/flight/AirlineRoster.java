package com.aircontrol.scheduler.flight;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/** Fixed list of airlines configured for the simulation. */
public class AirlineRoster {
  private final List<Airline> airlines;

  public AirlineRoster(List<Airline> airlines) {
    if (airlines.isEmpty()) {
      throw new IllegalArgumentException("scheduler.airlines must not be empty");
    }
    this.airlines = List.copyOf(airlines);
  }

  public List<Airline> all() {
    return airlines;
  }

  public Optional<Airline> find(String name) {
    return airlines.stream().filter(airline -> airline.name().equalsIgnoreCase(name)).findFirst();
  }

  public List<Airline> withCapacity() {
    return airlines.stream().filter(Airline::hasCapacity).collect(Collectors.toList());
  }

  public List<Airline> withCapacity(AircraftCategory category) {
    return airlines.stream()
        .filter(airline -> airline.primaryCategory() == category)
        .filter(Airline::hasCapacity)
        .collect(Collectors.toList());
  }
}
