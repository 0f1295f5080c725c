package com.aircontrol.scheduler.violation;

import com.aircontrol.scheduler.billing.NoticeIssuer;
import com.aircontrol.scheduler.billing.NoticeRequest;
import com.aircontrol.scheduler.flight.Flight;
import com.aircontrol.scheduler.flight.FlightSnapshot;
import com.aircontrol.scheduler.phase.FlightPhase;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Speed compliance checks over airborne flights.
 *
 * <p>For every inspected aircraft the monitor keeps the last {@value #HISTORY_SIZE} speed samples of
 * its current phase. A sample outside the envelope, or a mean rate of speed change above
 * {@value #ERRATIC_THRESHOLD} km/h per simulated second across at least
 * {@value #MIN_PATTERN_SAMPLES} samples, produces a violation. The rate is taken against the time
 * between samples, so sparse sampling of a compliant ramp is not mistaken for erratic flying. Each (aircraft, phase) pair yields at most one record; the guard lives on the aircraft.
 *
 * <p>Notice issuance runs after every lock is released.
 */
public class ViolationMonitor {
  private static final Logger log = LoggerFactory.getLogger(ViolationMonitor.class);

  static final int HISTORY_SIZE = 10;
  static final int MIN_PATTERN_SAMPLES = 3;
  static final double ERRATIC_THRESHOLD = 50.0;

  private final NoticeIssuer noticeIssuer;
  private final FineSchedule fineSchedule;
  private final Counter violationCounter;
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, SpeedHistory> histories = new HashMap<>();
  private final List<ViolationRecord> records = new ArrayList<>();
  private final Map<String, Integer> countsByAirline = new TreeMap<>();
  private final Map<FlightPhase, Integer> countsByPhase = new EnumMap<>(FlightPhase.class);

  public ViolationMonitor(
      NoticeIssuer noticeIssuer, FineSchedule fineSchedule, MeterRegistry meterRegistry) {
    this.noticeIssuer = noticeIssuer;
    this.fineSchedule = fineSchedule;
    this.violationCounter = meterRegistry.counter("scheduler.violations.total");
  }

  /**
   * Samples one flight and records a violation if one is detected.
   *
   * @param flight flight to sample
   * @param now simulation seconds
   * @return the new record, empty when the sample is compliant or the phase was already flagged
   */
  public Optional<ViolationRecord> inspect(Flight flight, double now) {
    FlightSnapshot sample = flight.snapshot();
    if (!sample.status().isAirborne()) {
      return Optional.empty();
    }
    boolean outOfEnvelope = sample.speed() < sample.minAllowedSpeed()
        || sample.speed() > sample.maxAllowedSpeed();
    double meanDelta;
    lock.lock();
    try {
      SpeedHistory history = histories.computeIfAbsent(sample.aircraftId(), id -> new SpeedHistory());
      history.add(sample.phase(), now, sample.speed());
      meanDelta = history.meanAbsoluteDelta();
    } finally {
      lock.unlock();
    }
    boolean erratic = meanDelta > ERRATIC_THRESHOLD;
    if (!outOfEnvelope && !erratic) {
      return Optional.empty();
    }
    if (!flight.tryFlagViolation(sample.phase())) {
      return Optional.empty();
    }

    ViolationRecord record = toRecord(sample, outOfEnvelope, meanDelta, now);
    lock.lock();
    try {
      records.add(record);
      countsByAirline.merge(record.airlineName(), 1, Integer::sum);
      countsByPhase.merge(record.phase(), 1, Integer::sum);
    } finally {
      lock.unlock();
    }
    violationCounter.increment();
    log.info("Violation {} for {} ({}): {}",
        record.kind(), record.aircraftId(), record.airlineName(), record.description());
    requestNotice(record);
    return Optional.of(record);
  }

  public List<ViolationRecord> records() {
    lock.lock();
    try {
      return List.copyOf(records);
    } finally {
      lock.unlock();
    }
  }

  public List<ViolationRecord> recordsForAirline(String airlineName) {
    return records().stream()
        .filter(record -> record.airlineName().equalsIgnoreCase(airlineName))
        .collect(Collectors.toList());
  }

  public List<ViolationRecord> recordsForAircraft(String aircraftId) {
    return records().stream()
        .filter(record -> record.aircraftId().equals(aircraftId))
        .collect(Collectors.toList());
  }

  public Map<String, Integer> countsByAirline() {
    lock.lock();
    try {
      return new TreeMap<>(countsByAirline);
    } finally {
      lock.unlock();
    }
  }

  public Map<FlightPhase, Integer> countsByPhase() {
    lock.lock();
    try {
      return new EnumMap<>(countsByPhase);
    } finally {
      lock.unlock();
    }
  }

  /** Sum of per-violation fees for {@code airlineName}, severe fee past the deviation limit. */
  public long calculateFines(String airlineName) {
    long total = 0;
    for (ViolationRecord record : recordsForAirline(airlineName)) {
      total += fineSchedule.feeFor(record);
    }
    return total;
  }

  /** Drops the speed history for aircraft that have left the registry. */
  public void forget(String aircraftId) {
    lock.lock();
    try {
      histories.remove(aircraftId);
    } finally {
      lock.unlock();
    }
  }

  private ViolationRecord toRecord(
      FlightSnapshot sample, boolean outOfEnvelope, double meanDelta, double now) {
    String description;
    if (outOfEnvelope) {
      description = String.format(
          "Speed %.1f km/h outside %s envelope [%.0f, %.0f]",
          sample.speed(), sample.phase(), sample.minAllowedSpeed(), sample.maxAllowedSpeed());
    } else {
      description = String.format(
          "Erratic speed in %s, mean change %.1f km/h per second", sample.phase(), meanDelta);
    }
    return new ViolationRecord(
        sample.aircraftId(),
        sample.flightNumber(),
        sample.airlineName(),
        sample.category(),
        sample.phase(),
        outOfEnvelope ? ViolationKind.OUT_OF_ENVELOPE : ViolationKind.ERRATIC,
        sample.speed(),
        sample.minAllowedSpeed(),
        sample.maxAllowedSpeed(),
        now,
        description);
  }

  private void requestNotice(ViolationRecord record) {
    try {
      String noticeId = noticeIssuer.issueNotice(new NoticeRequest(
          record.aircraftId(),
          record.airlineName(),
          record.flightNumber(),
          record.category(),
          record.actualSpeed(),
          record.minAllowedSpeed(),
          record.maxAllowedSpeed(),
          record.timestamp()));
      log.debug("Notice {} requested for {}", noticeId, record.aircraftId());
    } catch (RuntimeException ex) {
      log.warn("Notice issuance failed for {}", record.aircraftId(), ex);
    }
  }

  /** Rolling window of samples for the phase the aircraft is currently in. */
  private static final class SpeedHistory {
    private final Deque<double[]> samples = new ArrayDeque<>(HISTORY_SIZE);
    private FlightPhase phase;

    void add(FlightPhase samplePhase, double time, double speed) {
      if (samplePhase != phase) {
        // A phase change resamples speed; deltas across it are not erratic behaviour.
        samples.clear();
        phase = samplePhase;
      }
      if (samples.size() == HISTORY_SIZE) {
        samples.removeFirst();
      }
      samples.addLast(new double[] {time, speed});
    }

    /** Mean of |speed change| / elapsed time between consecutive samples, in km/h per second. */
    double meanAbsoluteDelta() {
      if (samples.size() < MIN_PATTERN_SAMPLES) {
        return 0.0;
      }
      Iterator<double[]> iterator = samples.iterator();
      double[] previous = iterator.next();
      double sum = 0.0;
      int deltas = 0;
      while (iterator.hasNext()) {
        double[] current = iterator.next();
        double elapsed = current[0] - previous[0];
        if (elapsed > 0) {
          sum += Math.abs(current[1] - previous[1]) / elapsed;
          deltas++;
        }
        previous = current;
      }
      return deltas == 0 ? 0.0 : sum / deltas;
    }
  }
}
