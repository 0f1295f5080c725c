package com.aircontrol.scheduler.api;

import com.aircontrol.scheduler.model.SimulationStatusResponse;
import com.aircontrol.scheduler.service.SimulationQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Simulation lifecycle endpoints.
 *
 * <ul>
 *   <li>{@code GET /api/simulation}: state and clock</li>
 *   <li>{@code POST /api/simulation/{action}}: start, pause, resume or stop</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/simulation")
public class SimulationController {
  private final SimulationQueryService queryService;

  public SimulationController(SimulationQueryService queryService) {
    this.queryService = queryService;
  }

  @GetMapping
  public SimulationStatusResponse status() {
    return queryService.status();
  }

  @PostMapping("/{action}")
  public SimulationStatusResponse control(@PathVariable("action") String action) {
    return queryService.control(action);
  }
}
