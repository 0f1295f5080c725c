package com.aircontrol.scheduler.api;

import com.aircontrol.scheduler.flight.FlightSnapshot;
import com.aircontrol.scheduler.model.FlightListResponse;
import com.aircontrol.scheduler.model.QueueStatusResponse;
import com.aircontrol.scheduler.model.RunwayListResponse;
import com.aircontrol.scheduler.runway.RunwaySnapshot;
import com.aircontrol.scheduler.service.SimulationQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Flight roster, runway occupancy and queue depth. */
@RestController
@RequestMapping("/api")
public class TrafficController {
  private final SimulationQueryService queryService;

  public TrafficController(SimulationQueryService queryService) {
    this.queryService = queryService;
  }

  /**
   * Lists flights, optionally filtered by status.
   *
   * @param status optional {@code FlightStatus} name, case-insensitive
   */
  @GetMapping("/flights")
  public FlightListResponse flights(
      @RequestParam(value = "status", required = false) String status) {
    return queryService.flights(status);
  }

  @GetMapping("/flights/{id}")
  public FlightSnapshot flight(@PathVariable("id") String id) {
    return queryService.flight(id);
  }

  @GetMapping("/runways")
  public RunwayListResponse runways() {
    return queryService.runways();
  }

  /**
   * Closes ({@code MAINTENANCE}, {@code WEATHER_CLOSED}) or reopens ({@code AVAILABLE}) a runway.
   */
  @PutMapping("/runways/{id}/status")
  public RunwaySnapshot updateRunwayStatus(
      @PathVariable("id") String id,
      @RequestParam(value = "value", required = false) String value) {
    return queryService.updateRunwayStatus(id, value);
  }

  @GetMapping("/queues")
  public QueueStatusResponse queues() {
    return queryService.queues();
  }
}
