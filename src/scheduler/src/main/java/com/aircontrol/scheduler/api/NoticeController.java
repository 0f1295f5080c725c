package com.aircontrol.scheduler.api;

import com.aircontrol.scheduler.billing.Notice;
import com.aircontrol.scheduler.model.PaymentRequest;
import com.aircontrol.scheduler.model.PaymentResponse;
import com.aircontrol.scheduler.service.SimulationQueryService;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * AVN endpoints.
 *
 * <ul>
 *   <li>{@code GET /api/notices}: all notices, or filtered by airline or aircraft</li>
 *   <li>{@code GET /api/notices/{id}}: one notice</li>
 *   <li>{@code POST /api/notices/{id}/payments}: confirm a payment</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/notices")
public class NoticeController {
  private final SimulationQueryService queryService;

  public NoticeController(SimulationQueryService queryService) {
    this.queryService = queryService;
  }

  @GetMapping
  public List<Notice> notices(
      @RequestParam(value = "airline", required = false) String airline,
      @RequestParam(value = "aircraft", required = false) String aircraft) {
    return queryService.notices(airline, aircraft);
  }

  @GetMapping("/{id}")
  public Notice notice(@PathVariable("id") String id) {
    return queryService.notice(id);
  }

  @PostMapping("/{id}/payments")
  public PaymentResponse pay(@PathVariable("id") String id, @RequestBody PaymentRequest request) {
    return queryService.pay(id, request.amount());
  }
}
