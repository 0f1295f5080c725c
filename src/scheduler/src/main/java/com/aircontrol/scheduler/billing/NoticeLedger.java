package com.aircontrol.scheduler.billing;

import com.aircontrol.scheduler.config.SchedulerProperties;
import com.aircontrol.scheduler.flight.AircraftCategory;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-process billing: issues AVNs, confirms payments and ages unpaid notices.
 *
 * <p>Fines depend on the aircraft category (cargo pays the cargo fine, everything else the
 * commercial one) plus a service fee. When a {@link RedisNoticePublisher} is present each state
 * change is also published for an external billing portal, outside the ledger lock.
 */
@Component
public class NoticeLedger implements NoticeIssuer {
  private static final Logger log = LoggerFactory.getLogger(NoticeLedger.class);
  private static final int FIRST_NOTICE_NUMBER = 1000;

  private final SchedulerProperties.Billing billing;
  private final Clock clock;
  private final Optional<RedisNoticePublisher> publisher;
  private final Map<String, Notice> notices = new LinkedHashMap<>();
  private int nextNumber = FIRST_NOTICE_NUMBER;

  public NoticeLedger(
      SchedulerProperties properties, Clock clock, Optional<RedisNoticePublisher> publisher) {
    this.billing = properties.getBilling();
    this.clock = clock;
    this.publisher = publisher;
    if (billing.getServiceFeeRate() < 0 || billing.getDueDays() <= 0) {
      throw new IllegalArgumentException("scheduler.billing fee rate or due days is invalid");
    }
  }

  @Override
  public String issueNotice(NoticeRequest request) {
    BigDecimal fine = BigDecimal.valueOf(request.category() == AircraftCategory.CARGO
        ? billing.getCargoFine()
        : billing.getCommercialFine()).setScale(2, RoundingMode.HALF_UP);
    BigDecimal fee = fine.multiply(BigDecimal.valueOf(billing.getServiceFeeRate()))
        .setScale(2, RoundingMode.HALF_UP);
    Instant issuedAt = clock.instant();
    Notice notice;
    synchronized (notices) {
      notice = new Notice(
          "AVN-" + nextNumber++,
          request.aircraftId(),
          request.airlineName(),
          request.flightNumber(),
          request.category(),
          request.recordedSpeed(),
          request.minAllowedSpeed(),
          request.maxAllowedSpeed(),
          request.simulationTime(),
          fine,
          fee,
          fine.add(fee),
          issuedAt,
          issuedAt.plus(Duration.ofDays(billing.getDueDays())),
          NoticeStatus.UNPAID,
          null,
          null);
      notices.put(notice.id(), notice);
    }
    log.info("Issued {} to {} for {} ({} due)",
        notice.id(), notice.airlineName(), notice.aircraftId(), notice.totalDue());
    publish("issued", notice);
    return notice.id();
  }

  /**
   * Confirms a payment; accepted only when {@code amount} covers the total due.
   *
   * @throws IllegalArgumentException when {@code amount} is negative
   */
  public PaymentOutcome confirmPayment(String noticeId, BigDecimal amount) {
    if (amount == null || amount.signum() < 0) {
      throw new IllegalArgumentException("Payment amount must be zero or positive");
    }
    Notice updated;
    synchronized (notices) {
      Notice current = notices.get(noticeId);
      if (current == null) {
        return PaymentOutcome.UNKNOWN_NOTICE;
      }
      if (current.status() == NoticeStatus.PAID) {
        return PaymentOutcome.ALREADY_PAID;
      }
      if (amount.compareTo(current.totalDue()) < 0) {
        return PaymentOutcome.INSUFFICIENT;
      }
      updated = current.paid(amount, clock.instant());
      notices.put(noticeId, updated);
    }
    log.info("Payment of {} accepted for {}", amount, noticeId);
    publish("paid", updated);
    return PaymentOutcome.ACCEPTED;
  }

  /**
   * Moves every UNPAID notice past its due date to OVERDUE.
   *
   * @return number of notices changed
   */
  public int markOverdue() {
    Instant now = clock.instant();
    List<Notice> changed = new ArrayList<>();
    synchronized (notices) {
      for (Notice notice : notices.values()) {
        if (notice.status() == NoticeStatus.UNPAID && now.isAfter(notice.dueAt())) {
          changed.add(notice.overdue());
        }
      }
      for (Notice notice : changed) {
        notices.put(notice.id(), notice);
      }
    }
    for (Notice notice : changed) {
      log.info("{} is overdue", notice.id());
      publish("overdue", notice);
    }
    return changed.size();
  }

  public Optional<Notice> find(String noticeId) {
    synchronized (notices) {
      return Optional.ofNullable(notices.get(noticeId));
    }
  }

  public List<Notice> all() {
    synchronized (notices) {
      return List.copyOf(notices.values());
    }
  }

  public List<Notice> forAirline(String airlineName) {
    return all().stream()
        .filter(notice -> notice.airlineName().equalsIgnoreCase(airlineName))
        .collect(Collectors.toList());
  }

  public List<Notice> forAircraft(String aircraftId) {
    return all().stream()
        .filter(notice -> notice.aircraftId().equals(aircraftId))
        .collect(Collectors.toList());
  }

  private void publish(String eventType, Notice notice) {
    if (publisher.isEmpty()) {
      return;
    }
    try {
      publisher.get().publish(eventType, notice);
    } catch (RuntimeException ex) {
      log.warn("Failed to publish {} event for {}", eventType, notice.id(), ex);
    }
  }
}
