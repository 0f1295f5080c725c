package com.aircontrol.scheduler.scheduler;

import com.aircontrol.scheduler.config.SchedulerProperties;
import com.aircontrol.scheduler.flight.AircraftCategory;
import com.aircontrol.scheduler.flight.Flight;
import com.aircontrol.scheduler.flight.FlightRegistry;
import com.aircontrol.scheduler.flight.FlightSnapshot;
import com.aircontrol.scheduler.flight.FlightStatus;
import com.aircontrol.scheduler.generation.FlightGenerator;
import com.aircontrol.scheduler.runway.RunwayId;
import com.aircontrol.scheduler.runway.RunwayPool;
import com.aircontrol.scheduler.runway.RunwaySelector;
import com.aircontrol.scheduler.runway.RunwayStatus;
import com.aircontrol.scheduler.violation.ViolationInjector;
import com.aircontrol.scheduler.violation.ViolationMonitor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drives the simulation.
 *
 * <p>Four worker loops run concurrently over the shared registry, runway pool and airline roster:
 * <ul>
 *   <li>time: advances the clock, activates due flights and moves airborne flights along their plans</li>
 *   <li>generation: creates new flights per direction</li>
 *   <li>monitoring: ground faults, speed violations, cargo presence, retention cleanup</li>
 *   <li>retry: drains the denied-flight queue with a bounded budget</li>
 * </ul>
 * Loops only meet at the pause gate. A failing cycle is counted and logged and the loop carries on.
 *
 * <p>{@link #step(double)} runs the same cycles once, in order, on the caller's thread, for use
 * while the loops are not running.
 */
@Component
public class SchedulerOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(SchedulerOrchestrator.class);
  private static final int LOOP_COUNT = 4;

  private final SchedulerProperties properties;
  private final SimulationClock clock;
  private final FlightRegistry registry;
  private final RunwayPool runwayPool;
  private final RunwaySelector runwaySelector;
  private final FlightGenerator generator;
  private final ViolationMonitor violationMonitor;
  private final ViolationInjector violationInjector;
  private final DeniedFlightQueue deniedQueue;
  private final Random random;
  private final MeterRegistry meterRegistry;

  private final Counter generatedCounter;
  private final Counter completedCounter;
  private final Counter canceledCounter;
  private final Counter denialCounter;
  private final AtomicInteger cargoLive;

  private final ReentrantLock stateLock = new ReentrantLock();
  private final Condition stateChanged = stateLock.newCondition();
  private volatile SimulationState state = SimulationState.INITIALIZED;
  private volatile boolean clockBaselineStale = true;
  private boolean initialized;
  private ExecutorService executor;
  private long lastWallNanos;
  private int cargoShortfallCycles;
  private int lastReportedCargoSurplus;

  public SchedulerOrchestrator(
      SchedulerProperties properties,
      SimulationClock clock,
      FlightRegistry registry,
      RunwayPool runwayPool,
      RunwaySelector runwaySelector,
      FlightGenerator generator,
      ViolationMonitor violationMonitor,
      ViolationInjector violationInjector,
      DeniedFlightQueue deniedQueue,
      Random random,
      MeterRegistry meterRegistry) {
    validate(properties);
    this.properties = properties;
    this.clock = clock;
    this.registry = registry;
    this.runwayPool = runwayPool;
    this.runwaySelector = runwaySelector;
    this.generator = generator;
    this.violationMonitor = violationMonitor;
    this.violationInjector = violationInjector;
    this.deniedQueue = deniedQueue;
    this.random = random;
    this.meterRegistry = meterRegistry;
    this.generatedCounter = meterRegistry.counter("scheduler.flights.generated");
    this.completedCounter = meterRegistry.counter("scheduler.flights.completed");
    this.canceledCounter = meterRegistry.counter("scheduler.flights.canceled");
    this.denialCounter = meterRegistry.counter("scheduler.runway.denials");
    this.cargoLive = meterRegistry.gauge("scheduler.cargo.live", new AtomicInteger(0));
    meterRegistry.gauge("scheduler.denied.depth", deniedQueue, DeniedFlightQueue::size);
    meterRegistry.gauge("scheduler.clock.seconds", clock, SimulationClock::now);
  }

  @PostConstruct
  public void autostart() {
    if (properties.isAutostart()) {
      start();
    }
  }

  public SimulationState state() {
    return state;
  }

  public double now() {
    return clock.now();
  }

  public double durationSeconds() {
    return properties.getDurationSeconds();
  }

  /** Seeds the initial flights and establishes cargo presence. Runs once. */
  public void initialize() {
    stateLock.lock();
    try {
      if (initialized) {
        return;
      }
      initialized = true;
    } finally {
      stateLock.unlock();
    }
    double now = clock.now();
    if (properties.isSeedInitialFlights()) {
      List<Flight> seeded =
          generator.seedInitialFlights(now, properties.getInitialFlightSpacingSeconds());
      generatedCounter.increment(seeded.size());
    }
    enforceCargoPresence(now);
    log.info("Simulation initialized with {} flights, duration {}s",
        registry.size(), properties.getDurationSeconds());
  }

  /** Starts the worker loops; only valid from INITIALIZED. */
  public boolean start() {
    stateLock.lock();
    try {
      if (state != SimulationState.INITIALIZED) {
        return false;
      }
      initialize();
      state = SimulationState.RUNNING;
      clockBaselineStale = true;
      AtomicInteger threadIndex = new AtomicInteger();
      executor = Executors.newFixedThreadPool(LOOP_COUNT, runnable -> {
        Thread thread = new Thread(runnable, "scheduler-loop-" + threadIndex.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      });
      SchedulerProperties.Loops loops = properties.getLoops();
      executor.submit(() -> runLoop("time", loops.getTimeAdvanceMs(), this::runTimeCycle));
      executor.submit(() -> runLoop("generation", loops.getGenerationMs(),
          () -> runGenerationCycle(clock.now())));
      executor.submit(() -> runLoop("monitoring", loops.getMonitoringMs(),
          () -> runMonitoringCycle(clock.now())));
      executor.submit(() -> runLoop("retry", loops.getRetryMs(),
          () -> runRetryCycle(clock.now())));
    } finally {
      stateLock.unlock();
    }
    log.info("Simulation started");
    return true;
  }

  public boolean pause() {
    stateLock.lock();
    try {
      if (state != SimulationState.RUNNING) {
        return false;
      }
      state = SimulationState.PAUSED;
      stateChanged.signalAll();
    } finally {
      stateLock.unlock();
    }
    log.info("Simulation paused at t={}", clock.now());
    return true;
  }

  public boolean resume() {
    stateLock.lock();
    try {
      if (state != SimulationState.PAUSED) {
        return false;
      }
      state = SimulationState.RUNNING;
      clockBaselineStale = true;
      stateChanged.signalAll();
    } finally {
      stateLock.unlock();
    }
    log.info("Simulation resumed at t={}", clock.now());
    return true;
  }

  /** True once the worker loops were started and have all exited. */
  boolean loopsTerminated() {
    stateLock.lock();
    try {
      return executor != null && executor.isTerminated();
    } finally {
      stateLock.unlock();
    }
  }

  @PreDestroy
  public void shutdown() {
    stop();
  }

  /**
   * Stops the simulation and joins the worker loops.
   *
   * @return false when the simulation had already stopped or completed
   */
  public boolean stop() {
    boolean changed;
    ExecutorService loops;
    stateLock.lock();
    try {
      changed = !state.isFinal();
      if (changed) {
        state = SimulationState.STOPPED;
        stateChanged.signalAll();
      }
      loops = executor;
    } finally {
      stateLock.unlock();
    }
    if (loops != null) {
      joinLoops(loops);
    }
    if (changed) {
      log.info("Simulation stopped at t={}", clock.now());
    }
    return changed;
  }

  /**
   * Runs one full tick on the calling thread.
   *
   * @param delta simulation seconds to advance
   * @return the new simulation time
   * @throws IllegalStateException while the worker loops are running
   */
  public double step(double delta) {
    if (state == SimulationState.RUNNING) {
      throw new IllegalStateException("Cannot step while the worker loops are running");
    }
    initialize();
    double now = clock.advance(delta);
    dispatchDueFlights(now);
    progressFlights(now);
    runGenerationCycle(now);
    runMonitoringCycle(now);
    runRetryCycle(now);
    return now;
  }

  /**
   * Changes a runway's status. Closing evicts the occupant; reopening only works from a closed
   * status.
   *
   * @throws IllegalArgumentException for {@link RunwayStatus#IN_USE}, which only assignment sets
   */
  public boolean setRunwayStatus(RunwayId runway, RunwayStatus status) {
    if (status == RunwayStatus.IN_USE) {
      throw new IllegalArgumentException("IN_USE is set by runway assignment only");
    }
    if (status == RunwayStatus.AVAILABLE) {
      boolean reopened = runwayPool.reopen(runway);
      if (reopened) {
        log.info("Runway {} reopened", runway);
      }
      return reopened;
    }
    Optional<String> evicted = runwayPool.close(runway, status, clock.now());
    log.warn("Runway {} closed: {}", runway, status);
    evicted.flatMap(registry::findByAircraft).ifPresent(flight -> {
      flight.onRunwayEvicted(runway);
      log.warn("Aircraft {} evicted from {}", flight.aircraftId(), runway);
    });
    return true;
  }

  /**
   * Tries every due SCHEDULED flight in priority order, queued ones included, so a freed runway
   * goes to a waiting emergency before a newly due commercial flight.
   *
   * @param now simulation seconds
   */
  void dispatchDueFlights(double now) {
    List<Flight> due = registry.byStatus(FlightStatus.SCHEDULED).stream()
        .filter(flight -> flight.scheduledTime() <= now)
        .sorted(Comparator.comparingInt((Flight flight) -> flight.category().priority())
            .thenComparingDouble(Flight::scheduledTime))
        .collect(Collectors.toList());
    for (Flight flight : due) {
      if (attemptActivation(flight, now)) {
        deniedQueue.remove(flight.id());
        continue;
      }
      if (flight.status() == FlightStatus.SCHEDULED && deniedQueue.offer(flight)) {
        denialCounter.increment();
        log.debug("Flight {} denied a runway at t={}, queued for retry", flight.id(), now);
      }
    }
  }

  void progressFlights(double now) {
    for (Flight flight : registry.airborne()) {
      if (flight.advancePlan(now, runwayPool, violationInjector)) {
        completedCounter.increment();
        log.info("Flight {} completed at t={}", flight.id(), now);
      }
    }
  }

  void runGenerationCycle(double now) {
    List<Flight> created = generator.generate(now);
    generatedCounter.increment(created.size());
  }

  void runMonitoringCycle(double now) {
    for (Flight flight : registry.airborne()) {
      if (flight.checkGroundFault(
          random, properties.getGroundFaultProbability(), now, runwayPool)) {
        canceledCounter.increment();
        log.warn("Ground fault on {}, flight {} canceled", flight.aircraftId(), flight.id());
        continue;
      }
      violationMonitor.inspect(flight, now);
    }
    enforceCargoPresence(now);
    purgeRetired(now);
  }

  void runRetryCycle(double now) {
    DeniedFlightQueue.DrainResult result =
        deniedQueue.drain(properties.getDeniedRetryBudget(), flight -> attemptActivation(flight, now));
    if (result.attempted() > 0) {
      log.debug("Retry cycle: attempted={}, assigned={}, requeued={}, dropped={}",
          result.attempted(), result.assigned(), result.requeued(), result.dropped());
    }
  }

  synchronized void enforceCargoPresence(double now) {
    int live = registry.countLive(AircraftCategory.CARGO);
    if (live == 0) {
      if (generator.synthesizeCargoFlight(now).isPresent()) {
        generatedCounter.increment();
        cargoShortfallCycles = 0;
        live = 1;
      } else {
        cargoShortfallCycles++;
        if (cargoShortfallCycles == properties.getCargoShortfallWarnCycles()) {
          log.warn("No cargo flight for {} cycles: no airline has fleet capacity",
              cargoShortfallCycles);
        } else {
          log.debug("No cargo flight and no capacity to create one at t={}", now);
        }
      }
    } else {
      cargoShortfallCycles = 0;
    }
    if (live > 1 && live != lastReportedCargoSurplus) {
      log.info("{} live cargo flights, expected exactly one", live);
    }
    lastReportedCargoSurplus = live > 1 ? live : 0;
    cargoLive.set(live);
  }

  private void purgeRetired(double now) {
    if (properties.getRetentionSeconds() <= 0) {
      return;
    }
    List<Flight> removed = registry.purgeTerminalBefore(now - properties.getRetentionSeconds());
    for (Flight flight : removed) {
      violationMonitor.forget(flight.aircraftId());
    }
    if (!removed.isEmpty()) {
      log.debug("Purged {} terminal flights", removed.size());
    }
  }

  private boolean attemptActivation(Flight flight, double now) {
    List<RunwayId> candidates = runwaySelector.candidates(flight.category(), flight.direction());
    if (!flight.tryActivate(now, runwayPool, candidates, violationInjector)) {
      return false;
    }
    FlightSnapshot snapshot = flight.snapshot();
    if (snapshot.assignedRunway() != null) {
      meterRegistry.counter("scheduler.runway.assignments",
          "runway", snapshot.assignedRunway().name()).increment();
    }
    log.info("Flight {} ({} {}) activated on {} at t={}",
        flight.id(), snapshot.category(), snapshot.direction(), snapshot.assignedRunway(), now);
    return true;
  }

  private void runTimeCycle() {
    long wallNow = System.nanoTime();
    if (clockBaselineStale) {
      clockBaselineStale = false;
      lastWallNanos = wallNow;
      return;
    }
    double wallDelta = (wallNow - lastWallNanos) / 1_000_000_000.0;
    lastWallNanos = wallNow;
    double delta = Math.min(wallDelta * properties.getTimeScale(), properties.getMaxTickSeconds());
    double now = clock.advance(delta);
    dispatchDueFlights(now);
    progressFlights(now);
    if (now >= properties.getDurationSeconds()) {
      complete();
    }
  }

  private void complete() {
    stateLock.lock();
    try {
      if (state != SimulationState.RUNNING) {
        return;
      }
      state = SimulationState.COMPLETED;
      stateChanged.signalAll();
      // Called from a loop thread: let the loops drain instead of joining them here.
      executor.shutdown();
    } finally {
      stateLock.unlock();
    }
    log.info("Simulation completed at t={}", clock.now());
  }

  private void runLoop(String name, long intervalMs, Runnable cycle) {
    Counter errors = meterRegistry.counter("scheduler.loop.errors", "loop", name);
    try {
      while (awaitRunning()) {
        try {
          cycle.run();
        } catch (RuntimeException ex) {
          errors.increment();
          log.warn("Scheduler {} cycle failed", name, ex);
        }
        sleepUnlessStopped(intervalMs);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.debug("Scheduler {} loop interrupted", name);
    }
    log.debug("Scheduler {} loop exited", name);
  }

  /** Parks while paused; returns false once the simulation has stopped or completed. */
  private boolean awaitRunning() throws InterruptedException {
    stateLock.lock();
    try {
      while (state == SimulationState.PAUSED) {
        stateChanged.await();
      }
      return state == SimulationState.RUNNING;
    } finally {
      stateLock.unlock();
    }
  }

  private void sleepUnlessStopped(long intervalMs) throws InterruptedException {
    stateLock.lock();
    try {
      if (state == SimulationState.RUNNING) {
        stateChanged.await(intervalMs, TimeUnit.MILLISECONDS);
      }
    } finally {
      stateLock.unlock();
    }
  }

  private void joinLoops(ExecutorService loops) {
    loops.shutdown();
    try {
      if (!loops.awaitTermination(properties.getLoops().getJoinTimeoutMs(), TimeUnit.MILLISECONDS)) {
        log.warn("Scheduler loops did not stop within {} ms, interrupting",
            properties.getLoops().getJoinTimeoutMs());
        loops.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      loops.shutdownNow();
    }
  }

  private static void validate(SchedulerProperties properties) {
    if (properties.getDurationSeconds() <= 0) {
      throw new IllegalArgumentException("scheduler.duration-seconds must be positive");
    }
    if (properties.getTimeScale() <= 0) {
      throw new IllegalArgumentException("scheduler.time-scale must be positive");
    }
    if (properties.getMaxTickSeconds() <= 0) {
      throw new IllegalArgumentException("scheduler.max-tick-seconds must be positive");
    }
    if (properties.getDeniedRetryBudget() <= 0) {
      throw new IllegalArgumentException("scheduler.denied-retry-budget must be positive");
    }
    double faultProbability = properties.getGroundFaultProbability();
    if (faultProbability < 0.0 || faultProbability > 1.0) {
      throw new IllegalArgumentException("scheduler.ground-fault-probability must be within [0, 1]");
    }
    SchedulerProperties.Loops loops = properties.getLoops();
    if (loops.getTimeAdvanceMs() <= 0
        || loops.getGenerationMs() <= 0
        || loops.getMonitoringMs() <= 0
        || loops.getRetryMs() <= 0
        || loops.getJoinTimeoutMs() <= 0) {
      throw new IllegalArgumentException("scheduler.loops intervals must be positive");
    }
  }
}
