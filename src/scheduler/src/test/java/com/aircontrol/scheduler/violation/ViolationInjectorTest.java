package com.aircontrol.scheduler.violation;

import static com.aircontrol.scheduler.TrafficFixtures.aircraft;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aircontrol.scheduler.flight.Aircraft;
import com.aircontrol.scheduler.flight.AircraftCategory;
import com.aircontrol.scheduler.flight.Direction;
import java.util.Random;
import org.junit.jupiter.api.Test;

class ViolationInjectorTest {

  @Test
  void alwaysInjectsOutsideTheEnvelopeWhenCertain() {
    ViolationInjector injector = new ViolationInjector(new Random(3), 1.0, 5, 40);

    for (int i = 0; i < 25; i++) {
      Aircraft aircraft = aircraft(AircraftCategory.COMMERCIAL, Direction.NORTH);

      assertThat(injector.maybeInject(aircraft)).isTrue();
      assertThat(aircraft.phaseMachine().isSpeedValid()).isFalse();
      assertThat(aircraft.phaseMachine().isHolding()).isTrue();
    }
  }

  @Test
  void neverGoesBelowZero() {
    ViolationInjector injector = new ViolationInjector(new Random(11), 1.0, 5, 40);

    for (int i = 0; i < 25; i++) {
      Aircraft atGate = aircraft(AircraftCategory.CARGO, Direction.EAST);
      injector.maybeInject(atGate);

      assertThat(atGate.speed()).isBetween(10.0, 45.0);
    }
  }

  @Test
  void emergencyAircraftAreLeftAlone() {
    ViolationInjector injector = new ViolationInjector(new Random(5), 1.0, 5, 40);
    Aircraft emergency = aircraft(AircraftCategory.EMERGENCY, Direction.SOUTH);

    assertThat(injector.maybeInject(emergency)).isFalse();
    assertThat(emergency.phaseMachine().isHolding()).isFalse();
  }

  @Test
  void zeroProbabilityNeverInjects() {
    ViolationInjector injector = new ViolationInjector(new Random(5), 0.0, 5, 40);

    assertThat(injector.maybeInject(aircraft(AircraftCategory.CARGO, Direction.WEST))).isFalse();
  }

  @Test
  void rejectsInvalidSettings() {
    assertThatThrownBy(() -> new ViolationInjector(new Random(), 1.5, 5, 40))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ViolationInjector(new Random(), 0.1, 50, 40))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
