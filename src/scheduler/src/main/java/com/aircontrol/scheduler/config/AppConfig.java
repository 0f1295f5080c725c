package com.aircontrol.scheduler.config;

import com.aircontrol.scheduler.billing.NoticeIssuer;
import com.aircontrol.scheduler.flight.Airline;
import com.aircontrol.scheduler.flight.AirlineRoster;
import com.aircontrol.scheduler.flight.Direction;
import com.aircontrol.scheduler.flight.FlightFactory;
import com.aircontrol.scheduler.flight.FlightRegistry;
import com.aircontrol.scheduler.generation.DirectionSchedule;
import com.aircontrol.scheduler.generation.FlightGenerator;
import com.aircontrol.scheduler.phase.FlightPhase;
import com.aircontrol.scheduler.phase.SpeedEnvelope;
import com.aircontrol.scheduler.phase.SpeedEnvelopeTable;
import com.aircontrol.scheduler.runway.RunwayPool;
import com.aircontrol.scheduler.runway.RunwaySelector;
import com.aircontrol.scheduler.scheduler.DeniedFlightQueue;
import com.aircontrol.scheduler.scheduler.SimulationClock;
import com.aircontrol.scheduler.violation.FineSchedule;
import com.aircontrol.scheduler.violation.ViolationInjector;
import com.aircontrol.scheduler.violation.ViolationMonitor;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Builds the simulation's shared state from {@link SchedulerProperties}. */
@Configuration
public class AppConfig {
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public Random simulationRandom(SchedulerProperties properties) {
    Long seed = properties.getRandomSeed();
    return seed == null ? new Random() : new Random(seed);
  }

  @Bean
  public SimulationClock simulationClock() {
    return new SimulationClock();
  }

  @Bean
  public SpeedEnvelopeTable speedEnvelopeTable(SchedulerProperties properties) {
    Map<FlightPhase, SpeedEnvelope> envelopes = new EnumMap<>(FlightPhase.class);
    properties.getEnvelopes().forEach((phase, settings) -> {
      if (settings.getMin() > settings.getMax()) {
        throw new IllegalArgumentException("scheduler.envelopes." + phase + " has min > max");
      }
      envelopes.put(phase, new SpeedEnvelope(settings.getMin(), settings.getMax()));
    });
    return new SpeedEnvelopeTable(envelopes);
  }

  @Bean
  public AirlineRoster airlineRoster(SchedulerProperties properties) {
    List<Airline> airlines = properties.getAirlines().stream()
        .map(settings -> new Airline(
            settings.getName(),
            settings.getCode(),
            settings.getPrimaryCategory(),
            settings.getTotalAircraft(),
            settings.getInitialActiveFlights()))
        .collect(Collectors.toList());
    return new AirlineRoster(airlines);
  }

  @Bean
  public FlightRegistry flightRegistry() {
    return new FlightRegistry();
  }

  @Bean
  public FlightFactory flightFactory(SpeedEnvelopeTable envelopes, Random simulationRandom) {
    return new FlightFactory(envelopes, simulationRandom);
  }

  @Bean
  public FlightGenerator flightGenerator(
      AirlineRoster roster,
      FlightFactory factory,
      FlightRegistry registry,
      SchedulerProperties properties,
      Random simulationRandom) {
    Map<Direction, DirectionSchedule> schedules = new EnumMap<>(Direction.class);
    properties.getDirections().forEach((direction, settings) -> schedules.put(
        direction,
        new DirectionSchedule(settings.getIntervalSeconds(), settings.getEmergencyProbability())));
    return new FlightGenerator(roster, factory, registry, schedules, simulationRandom);
  }

  @Bean
  public RunwayPool runwayPool(SchedulerProperties properties) {
    return new RunwayPool(properties.isAllowCommercialOverflow());
  }

  @Bean
  public RunwaySelector runwaySelector(SchedulerProperties properties) {
    return new RunwaySelector(properties.isAllowCommercialOverflow());
  }

  @Bean
  public DeniedFlightQueue deniedFlightQueue() {
    return new DeniedFlightQueue();
  }

  @Bean
  public ViolationInjector violationInjector(
      SchedulerProperties properties, Random simulationRandom) {
    SchedulerProperties.Injection injection = properties.getInjection();
    return new ViolationInjector(
        simulationRandom,
        injection.getProbability(),
        injection.getMinExcess(),
        injection.getMaxExcess());
  }

  @Bean
  public ViolationMonitor violationMonitor(
      NoticeIssuer noticeIssuer, SchedulerProperties properties, MeterRegistry meterRegistry) {
    SchedulerProperties.Fines fines = properties.getFines();
    return new ViolationMonitor(
        noticeIssuer,
        new FineSchedule(fines.getBase(), fines.getSevere(), fines.getSevereDeviation()),
        meterRegistry);
  }
}
