package com.aircontrol.scheduler.service;

import com.aircontrol.scheduler.api.BadRequestException;
import com.aircontrol.scheduler.api.ConflictException;
import com.aircontrol.scheduler.api.NotFoundException;
import com.aircontrol.scheduler.billing.Notice;
import com.aircontrol.scheduler.billing.NoticeLedger;
import com.aircontrol.scheduler.billing.PaymentOutcome;
import com.aircontrol.scheduler.flight.AirlineRoster;
import com.aircontrol.scheduler.flight.Flight;
import com.aircontrol.scheduler.flight.FlightRegistry;
import com.aircontrol.scheduler.flight.FlightSnapshot;
import com.aircontrol.scheduler.flight.FlightStatus;
import com.aircontrol.scheduler.model.FineSummaryResponse;
import com.aircontrol.scheduler.model.FlightListResponse;
import com.aircontrol.scheduler.model.PaymentResponse;
import com.aircontrol.scheduler.model.QueueStatusResponse;
import com.aircontrol.scheduler.model.RunwayListResponse;
import com.aircontrol.scheduler.model.SimulationStatusResponse;
import com.aircontrol.scheduler.model.ViolationCountsResponse;
import com.aircontrol.scheduler.phase.FlightPhase;
import com.aircontrol.scheduler.runway.RunwayId;
import com.aircontrol.scheduler.runway.RunwayPool;
import com.aircontrol.scheduler.runway.RunwaySnapshot;
import com.aircontrol.scheduler.runway.RunwayStatus;
import com.aircontrol.scheduler.scheduler.DeniedFlightQueue;
import com.aircontrol.scheduler.scheduler.SchedulerOrchestrator;
import com.aircontrol.scheduler.violation.ViolationMonitor;
import com.aircontrol.scheduler.violation.ViolationRecord;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/**
 * Read side of the simulation plus the few operator commands the API exposes.
 *
 * <p>Translates request parameters into domain calls and domain refusals into API exceptions.
 */
@Service
public class SimulationQueryService {
  private final SchedulerOrchestrator orchestrator;
  private final FlightRegistry registry;
  private final RunwayPool runwayPool;
  private final DeniedFlightQueue deniedQueue;
  private final ViolationMonitor violationMonitor;
  private final NoticeLedger noticeLedger;
  private final AirlineRoster airlineRoster;

  public SimulationQueryService(
      SchedulerOrchestrator orchestrator,
      FlightRegistry registry,
      RunwayPool runwayPool,
      DeniedFlightQueue deniedQueue,
      ViolationMonitor violationMonitor,
      NoticeLedger noticeLedger,
      AirlineRoster airlineRoster) {
    this.orchestrator = orchestrator;
    this.registry = registry;
    this.runwayPool = runwayPool;
    this.deniedQueue = deniedQueue;
    this.violationMonitor = violationMonitor;
    this.noticeLedger = noticeLedger;
    this.airlineRoster = airlineRoster;
  }

  public SimulationStatusResponse status() {
    double now = orchestrator.now();
    double duration = orchestrator.durationSeconds();
    return new SimulationStatusResponse(
        orchestrator.state(),
        now,
        duration,
        Math.max(0.0, duration - now),
        registry.size(),
        Instant.now().toString());
  }

  /**
   * Applies a lifecycle command.
   *
   * @param action one of {@code start|pause|resume|stop}
   */
  public SimulationStatusResponse control(String action) {
    String normalized = action == null ? "" : action.trim().toLowerCase(Locale.ROOT);
    boolean applied = switch (normalized) {
      case "start" -> orchestrator.start();
      case "pause" -> orchestrator.pause();
      case "resume" -> orchestrator.resume();
      case "stop" -> orchestrator.stop();
      default -> throw new BadRequestException("unknown action: " + action);
    };
    if (!applied) {
      throw new ConflictException(
          "cannot " + normalized + " while simulation is " + orchestrator.state());
    }
    return status();
  }

  public FlightListResponse flights(String status) {
    List<Flight> flights = status == null || status.isBlank()
        ? registry.snapshot()
        : registry.byStatus(parseEnum(FlightStatus.class, status, "status"));
    List<FlightSnapshot> items = flights.stream()
        .map(Flight::snapshot)
        .collect(Collectors.toList());
    return new FlightListResponse(items, items.size(), Instant.now().toString());
  }

  public FlightSnapshot flight(String flightId) {
    return registry.find(flightId)
        .map(Flight::snapshot)
        .orElseThrow(() -> new NotFoundException("flight not found: " + flightId));
  }

  public RunwayListResponse runways() {
    return new RunwayListResponse(
        runwayPool.snapshot(), runwayPool.allowsCommercialOverflow(), Instant.now().toString());
  }

  /** Closes or reopens a runway. */
  public RunwaySnapshot updateRunwayStatus(String runwayId, String value) {
    RunwayId id = parseEnum(RunwayId.class, runwayId, "runway");
    RunwayStatus target = parseEnum(RunwayStatus.class, value, "value");
    if (target == RunwayStatus.IN_USE) {
      throw new BadRequestException("IN_USE cannot be set directly");
    }
    if (!orchestrator.setRunwayStatus(id, target)) {
      throw new ConflictException("runway " + id + " is not closed");
    }
    return runwayPool.runway(id).snapshot();
  }

  public QueueStatusResponse queues() {
    int scheduled = 0;
    int active = 0;
    int emergency = 0;
    for (Flight flight : registry.snapshot()) {
      switch (flight.status()) {
        case SCHEDULED -> scheduled++;
        case ACTIVE -> active++;
        case EMERGENCY -> emergency++;
        default -> {
          // terminal flights are not queued anywhere
        }
      }
    }
    return new QueueStatusResponse(
        deniedQueue.size(), deniedQueue.ids(), scheduled, active, emergency,
        Instant.now().toString());
  }

  public List<ViolationRecord> violations(String airline, String aircraft) {
    if (aircraft != null && !aircraft.isBlank()) {
      return violationMonitor.recordsForAircraft(aircraft);
    }
    if (airline != null && !airline.isBlank()) {
      return violationMonitor.recordsForAirline(airline);
    }
    return violationMonitor.records();
  }

  public ViolationCountsResponse violationCounts() {
    Map<String, Integer> byAirline = violationMonitor.countsByAirline();
    Map<FlightPhase, Integer> byPhase = violationMonitor.countsByPhase();
    int total = byAirline.values().stream().mapToInt(Integer::intValue).sum();
    return new ViolationCountsResponse(byAirline, byPhase, total);
  }

  public FineSummaryResponse fines(String airline) {
    String name = airlineRoster.find(airline)
        .map(found -> found.name())
        .orElseThrow(() -> new NotFoundException("airline not found: " + airline));
    return new FineSummaryResponse(
        name,
        violationMonitor.recordsForAirline(name).size(),
        violationMonitor.calculateFines(name));
  }

  public List<Notice> notices(String airline, String aircraft) {
    if (aircraft != null && !aircraft.isBlank()) {
      return noticeLedger.forAircraft(aircraft);
    }
    if (airline != null && !airline.isBlank()) {
      return noticeLedger.forAirline(airline);
    }
    return noticeLedger.all();
  }

  public Notice notice(String noticeId) {
    return noticeLedger.find(noticeId)
        .orElseThrow(() -> new NotFoundException("notice not found: " + noticeId));
  }

  /** Confirms a payment; INSUFFICIENT and ALREADY_PAID surface as conflicts. */
  public PaymentResponse pay(String noticeId, BigDecimal amount) {
    if (amount == null || amount.signum() < 0) {
      throw new BadRequestException("amount must be zero or positive");
    }
    PaymentOutcome outcome = noticeLedger.confirmPayment(noticeId, amount);
    return switch (outcome) {
      case ACCEPTED -> new PaymentResponse(noticeId, outcome, notice(noticeId).status());
      case UNKNOWN_NOTICE -> throw new NotFoundException("notice not found: " + noticeId);
      case INSUFFICIENT -> throw new ConflictException(
          "amount " + amount + " is below total due for " + noticeId);
      case ALREADY_PAID -> throw new ConflictException(noticeId + " is already paid");
    };
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String raw, String field) {
    if (raw == null || raw.isBlank()) {
      throw new BadRequestException(field + " is required");
    }
    try {
      return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new BadRequestException("invalid " + field + ": " + raw);
    }
  }
}
