package com.aircontrol.scheduler.flight;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.EnumSet;
import org.junit.jupiter.api.Test;

class FlightStatusTest {

  @Test
  void scheduledMayActivateOrCancel() {
    assertThat(allowedFrom(FlightStatus.SCHEDULED))
        .containsExactlyInAnyOrder(FlightStatus.ACTIVE, FlightStatus.EMERGENCY, FlightStatus.CANCELED);
  }

  @Test
  void activeMayFinishOrEscalate() {
    assertThat(allowedFrom(FlightStatus.ACTIVE)).containsExactlyInAnyOrder(
        FlightStatus.COMPLETED, FlightStatus.CANCELED, FlightStatus.DIVERTED, FlightStatus.EMERGENCY);
    assertThat(allowedFrom(FlightStatus.EMERGENCY)).containsExactlyInAnyOrder(
        FlightStatus.COMPLETED, FlightStatus.CANCELED, FlightStatus.DIVERTED);
  }

  @Test
  void terminalStatusesAcceptNothing() {
    for (FlightStatus terminal : EnumSet.of(
        FlightStatus.COMPLETED, FlightStatus.CANCELED, FlightStatus.DIVERTED)) {
      assertThat(terminal.isTerminal()).isTrue();
      assertThat(allowedFrom(terminal)).isEmpty();
    }
  }

  private static EnumSet<FlightStatus> allowedFrom(FlightStatus from) {
    EnumSet<FlightStatus> allowed = EnumSet.noneOf(FlightStatus.class);
    for (FlightStatus target : FlightStatus.values()) {
      if (from.canTransitionTo(target)) {
        allowed.add(target);
      }
    }
    return allowed;
  }
}
