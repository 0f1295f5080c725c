package com.aircontrol.scheduler.flight;

import static com.aircontrol.scheduler.TrafficFixtures.aircraft;
import static com.aircontrol.scheduler.TrafficFixtures.airline;
import static com.aircontrol.scheduler.TrafficFixtures.flight;
import static com.aircontrol.scheduler.TrafficFixtures.noInjection;
import static org.assertj.core.api.Assertions.assertThat;

import com.aircontrol.scheduler.phase.FlightPhase;
import com.aircontrol.scheduler.runway.RunwayId;
import com.aircontrol.scheduler.runway.RunwayPool;
import com.aircontrol.scheduler.runway.RunwayStatus;
import com.aircontrol.scheduler.violation.ViolationInjector;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class FlightTest {

  private final RunwayPool pool = new RunwayPool(false);
  private final ViolationInjector injector = noInjection();

  @Test
  void activationClaimsFirstGrantedRunway() {
    Flight cargo = flight(AircraftCategory.CARGO, Direction.NORTH);

    boolean activated =
        cargo.tryActivate(12.0, pool, List.of(RunwayId.RWY_C, RunwayId.RWY_A), injector);

    FlightSnapshot snapshot = cargo.snapshot();
    assertThat(activated).isTrue();
    assertThat(snapshot.status()).isEqualTo(FlightStatus.ACTIVE);
    assertThat(snapshot.assignedRunway()).isEqualTo(RunwayId.RWY_C);
    assertThat(snapshot.activationTime()).isEqualTo(12.0);
    assertThat(snapshot.delaySeconds()).isEqualTo(12.0);
    assertThat(snapshot.estimatedCompletionTime()).isEqualTo(162.0);
  }

  @Test
  void emergencyActivatesAsEmergencyOnExpeditedPlan() {
    Flight emergency = flight(AircraftCategory.EMERGENCY, Direction.EAST);

    emergency.tryActivate(0.0, pool, List.of(RunwayId.RWY_B, RunwayId.RWY_C), injector);

    assertThat(emergency.status()).isEqualTo(FlightStatus.EMERGENCY);
    assertThat(emergency.snapshot().estimatedCompletionTime()).isEqualTo(60.0);
  }

  @Test
  void activationFailsWhenNoCandidateIsGranted() {
    pool.tryAssign(aircraft(AircraftCategory.COMMERCIAL, Direction.SOUTH), RunwayId.RWY_A, 0);
    Flight commercial = flight(AircraftCategory.COMMERCIAL, Direction.NORTH);

    assertThat(commercial.tryActivate(1.0, pool, List.of(RunwayId.RWY_A), injector)).isFalse();
    assertThat(commercial.status()).isEqualTo(FlightStatus.SCHEDULED);
    assertThat(commercial.snapshot().assignedRunway()).isNull();
  }

  @Test
  void arrivalFollowsPlanAndReleasesRunwayAfterLanding() {
    Airline airline = airline("Northern", AircraftCategory.COMMERCIAL, 2);
    Flight arrival = flight(airline, aircraft(AircraftCategory.COMMERCIAL, Direction.NORTH), 0.0);
    arrival.tryActivate(0.0, pool, List.of(RunwayId.RWY_A), injector);

    arrival.advancePlan(30.0, pool, injector);
    assertThat(arrival.snapshot().phase()).isEqualTo(FlightPhase.APPROACH);

    arrival.advancePlan(60.0, pool, injector);
    assertThat(arrival.snapshot().phase()).isEqualTo(FlightPhase.LANDING);
    assertThat(arrival.snapshot().assignedRunway()).isEqualTo(RunwayId.RWY_A);

    arrival.advancePlan(90.0, pool, injector);
    assertThat(arrival.snapshot().phase()).isEqualTo(FlightPhase.TAXI_IN);
    assertThat(arrival.snapshot().assignedRunway()).isNull();
    assertThat(pool.runway(RunwayId.RWY_A).status()).isEqualTo(RunwayStatus.AVAILABLE);

    assertThat(arrival.advancePlan(120.0, pool, injector)).isFalse();
    assertThat(arrival.snapshot().phase()).isEqualTo(FlightPhase.AT_GATE_ARRIVAL);

    assertThat(arrival.advancePlan(150.0, pool, injector)).isTrue();
    assertThat(arrival.status()).isEqualTo(FlightStatus.COMPLETED);
    assertThat(arrival.terminalTime()).isEqualTo(150.0);
    assertThat(airline.activeFleetSize()).isZero();
  }

  @Test
  void departureKeepsRunwayUntilCruise() {
    Flight departure = flight(AircraftCategory.COMMERCIAL, Direction.WEST);
    departure.tryActivate(0.0, pool, List.of(RunwayId.RWY_B), injector);

    departure.advancePlan(80.0, pool, injector);
    assertThat(departure.snapshot().phase()).isEqualTo(FlightPhase.CLIMB);
    assertThat(departure.snapshot().assignedRunway()).isEqualTo(RunwayId.RWY_B);

    departure.advancePlan(90.0, pool, injector);
    assertThat(departure.snapshot().phase()).isEqualTo(FlightPhase.CRUISE);
    assertThat(pool.runway(RunwayId.RWY_B).status()).isEqualTo(RunwayStatus.AVAILABLE);
  }

  @Test
  void lateTickCatchesUpSeveralSteps() {
    Flight arrival = flight(AircraftCategory.COMMERCIAL, Direction.SOUTH);
    arrival.tryActivate(0.0, pool, List.of(RunwayId.RWY_A), injector);

    arrival.advancePlan(95.0, pool, injector);

    assertThat(arrival.snapshot().phase()).isEqualTo(FlightPhase.TAXI_IN);
    assertThat(pool.runway(RunwayId.RWY_A).status()).isEqualTo(RunwayStatus.AVAILABLE);
  }

  @Test
  void cancelReleasesRunwayAndFleetSlotOnce() {
    Airline airline = airline("Eastern", AircraftCategory.COMMERCIAL, 1);
    Flight departure = flight(airline, aircraft(AircraftCategory.COMMERCIAL, Direction.EAST), 0.0);
    departure.tryActivate(0.0, pool, List.of(RunwayId.RWY_B), injector);

    assertThat(departure.cancel("operator request", 4.0, pool)).isTrue();
    assertThat(departure.cancel("again", 5.0, pool)).isFalse();

    FlightSnapshot snapshot = departure.snapshot();
    assertThat(snapshot.status()).isEqualTo(FlightStatus.CANCELED);
    assertThat(snapshot.statusReason()).isEqualTo("operator request");
    assertThat(pool.runway(RunwayId.RWY_B).status()).isEqualTo(RunwayStatus.AVAILABLE);
    assertThat(airline.activeFleetSize()).isZero();
    assertThat(airline.hasCapacity()).isTrue();
  }

  @Test
  void terminalFlightIgnoresPlanAndActivation() {
    Flight flight = flight(AircraftCategory.COMMERCIAL, Direction.NORTH);
    flight.cancel("weather", 0.0, pool);

    assertThat(flight.tryActivate(1.0, pool, List.of(RunwayId.RWY_A), injector)).isFalse();
    assertThat(flight.advancePlan(500.0, pool, injector)).isFalse();
    assertThat(flight.status()).isEqualTo(FlightStatus.CANCELED);
  }

  @Test
  void groundFaultCancelsOnlyInGroundPhases() {
    Flight arrival = flight(AircraftCategory.COMMERCIAL, Direction.NORTH);
    arrival.tryActivate(0.0, pool, List.of(RunwayId.RWY_A), injector);
    Flight departure = flight(AircraftCategory.COMMERCIAL, Direction.EAST);
    departure.tryActivate(0.0, pool, List.of(RunwayId.RWY_B), injector);

    assertThat(arrival.checkGroundFault(new Random(1), 1.0, 1.0, pool)).isFalse();
    assertThat(departure.checkGroundFault(new Random(1), 1.0, 1.0, pool)).isTrue();

    FlightSnapshot canceled = departure.snapshot();
    assertThat(canceled.status()).isEqualTo(FlightStatus.CANCELED);
    assertThat(canceled.statusReason()).isEqualTo(Flight.GROUND_FAULT_REASON);
    assertThat(canceled.groundFault()).isTrue();
    assertThat(pool.runway(RunwayId.RWY_B).status()).isEqualTo(RunwayStatus.AVAILABLE);
  }

  @Test
  void violationFlaggedOncePerPhaseAndOnlyForCurrentPhase() {
    Flight arrival = flight(AircraftCategory.COMMERCIAL, Direction.NORTH);
    arrival.tryActivate(0.0, pool, List.of(RunwayId.RWY_A), injector);

    assertThat(arrival.tryFlagViolation(FlightPhase.APPROACH)).isFalse();
    assertThat(arrival.tryFlagViolation(FlightPhase.HOLDING)).isTrue();
    assertThat(arrival.tryFlagViolation(FlightPhase.HOLDING)).isFalse();

    arrival.advancePlan(30.0, pool, injector);

    assertThat(arrival.tryFlagViolation(FlightPhase.APPROACH)).isTrue();
    assertThat(arrival.snapshot().flaggedPhases())
        .containsExactlyInAnyOrder(FlightPhase.HOLDING, FlightPhase.APPROACH);
  }

  @Test
  void evictionClearsRunwayButFlightKeepsFlying() {
    Flight arrival = flight(AircraftCategory.COMMERCIAL, Direction.SOUTH);
    arrival.tryActivate(0.0, pool, List.of(RunwayId.RWY_A), injector);
    pool.close(RunwayId.RWY_A, RunwayStatus.MAINTENANCE, 5.0);

    arrival.onRunwayEvicted(RunwayId.RWY_A);
    arrival.advancePlan(30.0, pool, injector);

    assertThat(arrival.snapshot().assignedRunway()).isNull();
    assertThat(arrival.snapshot().phase()).isEqualTo(FlightPhase.APPROACH);
    assertThat(arrival.status()).isEqualTo(FlightStatus.ACTIVE);
  }
}
