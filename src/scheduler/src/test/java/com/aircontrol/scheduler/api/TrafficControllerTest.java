package com.aircontrol.scheduler.api;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.aircontrol.scheduler.flight.AircraftCategory;
import com.aircontrol.scheduler.flight.Direction;
import com.aircontrol.scheduler.flight.FlightSnapshot;
import com.aircontrol.scheduler.flight.FlightStatus;
import com.aircontrol.scheduler.model.FlightListResponse;
import com.aircontrol.scheduler.model.QueueStatusResponse;
import com.aircontrol.scheduler.model.RunwayListResponse;
import com.aircontrol.scheduler.phase.FlightPhase;
import com.aircontrol.scheduler.runway.RunwayId;
import com.aircontrol.scheduler.runway.RunwaySnapshot;
import com.aircontrol.scheduler.runway.RunwayStatus;
import com.aircontrol.scheduler.service.SimulationQueryService;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = TrafficController.class)
class TrafficControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private SimulationQueryService queryService;

  @Test
  void listFlights_returns200() throws Exception {
    when(queryService.flights(eq(null)))
        .thenReturn(new FlightListResponse(List.of(cargoFlight()), 1, "2026-02-13T12:00:00Z"));

    mockMvc.perform(get("/api/flights"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(1))
        .andExpect(jsonPath("$.items[0].flightId").value("FL-1000"))
        .andExpect(jsonPath("$.items[0].assignedRunway").value("RWY_C"))
        .andExpect(jsonPath("$.items[0].maxAllowedSpeed").value(600.0));
  }

  @Test
  void listFlights_invalidStatus_returns400() throws Exception {
    when(queryService.flights("LOST")).thenThrow(new BadRequestException("invalid status: LOST"));

    mockMvc.perform(get("/api/flights").param("status", "LOST"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("bad_request"));
  }

  @Test
  void flightDetail_notFound_returns404() throws Exception {
    when(queryService.flight("FL-9")).thenThrow(new NotFoundException("flight not found: FL-9"));

    mockMvc.perform(get("/api/flights/FL-9"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("not_found"))
        .andExpect(jsonPath("$.message").value("flight not found: FL-9"));
  }

  @Test
  void runways_returns200() throws Exception {
    when(queryService.runways()).thenReturn(new RunwayListResponse(
        List.of(
            new RunwaySnapshot(RunwayId.RWY_A, RunwayStatus.IN_USE, "PK-AC1001", 3, 90.0),
            new RunwaySnapshot(RunwayId.RWY_B, RunwayStatus.MAINTENANCE, null, 0, 0.0)),
        false,
        "2026-02-13T12:00:00Z"));

    mockMvc.perform(get("/api/runways"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.runways[0].status").value("IN_USE"))
        .andExpect(jsonPath("$.runways[0].occupantId").value("PK-AC1001"))
        .andExpect(jsonPath("$.runways[1].status").value("MAINTENANCE"))
        .andExpect(jsonPath("$.commercialOverflow").value(false));
  }

  @Test
  void updateRunwayStatus_returnsSnapshot() throws Exception {
    when(queryService.updateRunwayStatus("RWY_B", "WEATHER_CLOSED")).thenReturn(
        new RunwaySnapshot(RunwayId.RWY_B, RunwayStatus.WEATHER_CLOSED, null, 2, 40.0));

    mockMvc.perform(put("/api/runways/RWY_B/status").param("value", "WEATHER_CLOSED"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value("RWY_B"))
        .andExpect(jsonPath("$.status").value("WEATHER_CLOSED"));
  }

  @Test
  void updateRunwayStatus_reopenOpenRunway_returns409() throws Exception {
    when(queryService.updateRunwayStatus("RWY_A", "AVAILABLE"))
        .thenThrow(new ConflictException("runway RWY_A is not closed"));

    mockMvc.perform(put("/api/runways/RWY_A/status").param("value", "AVAILABLE"))
        .andExpect(status().isConflict());
  }

  @Test
  void queues_returns200() throws Exception {
    when(queryService.queues()).thenReturn(new QueueStatusResponse(
        2, List.of("FL-1003", "FL-1004"), 5, 2, 1, "2026-02-13T12:00:00Z"));

    mockMvc.perform(get("/api/queues"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.deniedDepth").value(2))
        .andExpect(jsonPath("$.deniedFlightIds[1]").value("FL-1004"))
        .andExpect(jsonPath("$.emergency").value(1));
  }

  @Test
  void unknownRoute_returns404() throws Exception {
    mockMvc.perform(get("/api/unknown"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("not_found"));
  }

  private static FlightSnapshot cargoFlight() {
    return new FlightSnapshot(
        "FL-1000",
        "FX1000",
        "FX-AC1000",
        "FedEx",
        AircraftCategory.CARGO,
        Direction.NORTH,
        FlightStatus.ACTIVE,
        FlightPhase.HOLDING,
        512.0,
        400.0,
        600.0,
        RunwayId.RWY_C,
        0.0,
        1.0,
        151.0,
        1.0,
        null,
        false,
        Set.of());
  }
}
