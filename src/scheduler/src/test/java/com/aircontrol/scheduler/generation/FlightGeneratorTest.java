package com.aircontrol.scheduler.generation;

import static org.assertj.core.api.Assertions.assertThat;

import com.aircontrol.scheduler.flight.AircraftCategory;
import com.aircontrol.scheduler.flight.Airline;
import com.aircontrol.scheduler.flight.AirlineRoster;
import com.aircontrol.scheduler.flight.Direction;
import com.aircontrol.scheduler.flight.Flight;
import com.aircontrol.scheduler.flight.FlightFactory;
import com.aircontrol.scheduler.flight.FlightRegistry;
import com.aircontrol.scheduler.flight.FlightSnapshot;
import com.aircontrol.scheduler.flight.FlightStatus;
import com.aircontrol.scheduler.phase.SpeedEnvelopeTable;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class FlightGeneratorTest {

  private final FlightRegistry registry = new FlightRegistry();
  private final Random random = new Random(42);
  private final FlightFactory factory = new FlightFactory(SpeedEnvelopeTable.defaults(), random);

  @Test
  void eachDirectionFollowsItsOwnInterval() {
    FlightGenerator generator = generator(roster(commercial("PIA", 50)), 0.0);

    assertThat(generator.generate(100.0)).isEmpty();
    assertThat(directions(generator.generate(120.0))).containsExactly(Direction.NORTH);
    assertThat(directions(generator.generate(150.0))).containsExactly(Direction.SOUTH);
    assertThat(directions(generator.generate(180.0))).containsExactly(Direction.EAST);
    assertThat(directions(generator.generate(240.0)))
        .containsExactly(Direction.NORTH, Direction.WEST);
    assertThat(registry.size()).isEqualTo(5);
  }

  @Test
  void generatedFlightsAreScheduledWithSequentialIds() {
    FlightGenerator generator = generator(roster(commercial("PIA", 50)), 0.0);

    List<Flight> created = generator.generate(1000.0);

    assertThat(created).extracting(Flight::id).containsExactly("FL-1000", "FL-1001", "FL-1002", "FL-1003");
    FlightSnapshot first = created.get(0).snapshot();
    assertThat(first.status()).isEqualTo(FlightStatus.SCHEDULED);
    assertThat(first.flightNumber()).isEqualTo("PK1000");
    assertThat(first.aircraftId()).isEqualTo("PK-AC1000");
    assertThat(first.scheduledTime()).isEqualTo(1000.0);
  }

  @Test
  void emergencyProbabilityOverridesAirlineCategory() {
    FlightGenerator generator = generator(roster(commercial("PIA", 50)), 1.0);

    assertThat(generator.generate(500.0))
        .extracting(Flight::category)
        .containsOnly(AircraftCategory.EMERGENCY);
  }

  @Test
  void directionWithoutCapacityRetriesOnNextCycle() {
    Airline tiny = commercial("PIA", 1);
    FlightGenerator generator = generator(roster(tiny), 0.0);

    List<Flight> first = generator.generate(120.0);
    assertThat(directions(first)).containsExactly(Direction.NORTH);

    assertThat(generator.generate(150.0)).isEmpty();

    tiny.release();
    assertThat(directions(generator.generate(151.0))).containsExactly(Direction.SOUTH);
  }

  @Test
  void cargoSynthesisPrefersCargoAirlines() {
    Airline fedEx = new Airline("FedEx", "FX", AircraftCategory.CARGO, 3, 0);
    FlightGenerator generator = generator(roster(commercial("PIA", 5), fedEx), 0.0);

    Optional<Flight> cargo = generator.synthesizeCargoFlight(10.0);

    assertThat(cargo).isPresent();
    assertThat(cargo.get().category()).isEqualTo(AircraftCategory.CARGO);
    assertThat(cargo.get().snapshot().airlineName()).isEqualTo("FedEx");
    assertThat(fedEx.activeFleetSize()).isEqualTo(1);
  }

  @Test
  void cargoSynthesisFallsBackToAnyAirlineAndGivesUpWhenAllFull() {
    Airline pia = commercial("PIA", 1);
    FlightGenerator generator = generator(roster(pia), 0.0);

    Optional<Flight> cargo = generator.synthesizeCargoFlight(10.0);

    assertThat(cargo).isPresent();
    assertThat(cargo.get().category()).isEqualTo(AircraftCategory.CARGO);
    assertThat(cargo.get().snapshot().airlineName()).isEqualTo("PIA");
    assertThat(generator.synthesizeCargoFlight(11.0)).isEmpty();
  }

  @Test
  void seedingSpacesInitialFlightsAndRespectsFleet() {
    Airline pia = new Airline("PIA", "PK", AircraftCategory.COMMERCIAL, 5, 3);
    Airline fedEx = new Airline("FedEx", "FX", AircraftCategory.CARGO, 2, 1);
    FlightGenerator generator = generator(roster(pia, fedEx), 0.0);

    List<Flight> seeded = generator.seedInitialFlights(0.0, 5.0);

    assertThat(seeded).extracting(Flight::scheduledTime).containsExactly(0.0, 5.0, 10.0, 15.0);
    assertThat(seeded).extracting(Flight::category).containsExactly(
        AircraftCategory.COMMERCIAL, AircraftCategory.COMMERCIAL, AircraftCategory.COMMERCIAL,
        AircraftCategory.CARGO);
    assertThat(pia.activeFleetSize()).isEqualTo(3);
    assertThat(fedEx.activeFleetSize()).isEqualTo(1);
    assertThat(registry.size()).isEqualTo(4);
  }

  private FlightGenerator generator(AirlineRoster roster, double emergencyProbability) {
    Map<Direction, DirectionSchedule> schedules = new EnumMap<>(Direction.class);
    schedules.put(Direction.NORTH, new DirectionSchedule(120, emergencyProbability));
    schedules.put(Direction.SOUTH, new DirectionSchedule(150, emergencyProbability));
    schedules.put(Direction.EAST, new DirectionSchedule(180, emergencyProbability));
    schedules.put(Direction.WEST, new DirectionSchedule(240, emergencyProbability));
    return new FlightGenerator(roster, factory, registry, schedules, random);
  }

  private static AirlineRoster roster(Airline... airlines) {
    return new AirlineRoster(List.of(airlines));
  }

  private static Airline commercial(String name, int fleet) {
    return new Airline(name, "PK", AircraftCategory.COMMERCIAL, fleet, 0);
  }

  private static List<Direction> directions(List<Flight> flights) {
    return flights.stream().map(Flight::direction).collect(Collectors.toList());
  }
}
