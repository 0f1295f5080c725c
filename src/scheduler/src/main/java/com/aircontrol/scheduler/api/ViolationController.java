package com.aircontrol.scheduler.api;

import com.aircontrol.scheduler.model.FineSummaryResponse;
import com.aircontrol.scheduler.model.ViolationCountsResponse;
import com.aircontrol.scheduler.service.SimulationQueryService;
import com.aircontrol.scheduler.violation.ViolationRecord;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/violations")
public class ViolationController {
  private final SimulationQueryService queryService;

  public ViolationController(SimulationQueryService queryService) {
    this.queryService = queryService;
  }

  @GetMapping
  public List<ViolationRecord> violations(
      @RequestParam(value = "airline", required = false) String airline,
      @RequestParam(value = "aircraft", required = false) String aircraft) {
    return queryService.violations(airline, aircraft);
  }

  @GetMapping("/counts")
  public ViolationCountsResponse counts() {
    return queryService.violationCounts();
  }

  @GetMapping("/fines/{airline}")
  public FineSummaryResponse fines(@PathVariable("airline") String airline) {
    return queryService.fines(airline);
  }
}
