package com.aircontrol.scheduler.config;

import com.aircontrol.scheduler.flight.AircraftCategory;
import com.aircontrol.scheduler.flight.Direction;
import com.aircontrol.scheduler.phase.FlightPhase;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the scheduler service.
 *
 * <p>Values are bound from {@code application.yml} and environment variables under the
 * {@code scheduler.*} prefix. Every field carries the default used when nothing overrides it.
 */
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {
  private final Loops loops = new Loops();
  private final Injection injection = new Injection();
  private final Fines fines = new Fines();
  private final Billing billing = new Billing();
  private double durationSeconds = 300;
  private double timeScale = 1.0;
  private double maxTickSeconds = 1.0;
  private boolean autostart = false;
  private Long randomSeed;
  private int deniedRetryBudget = 5;
  private boolean allowCommercialOverflow = false;
  private int cargoShortfallWarnCycles = 3;
  private double retentionSeconds = 120;
  private double groundFaultProbability = 0.002;
  private boolean seedInitialFlights = true;
  private double initialFlightSpacingSeconds = 20;
  private Map<Direction, DirectionSettings> directions = defaultDirections();
  private Map<FlightPhase, EnvelopeSettings> envelopes = defaultEnvelopes();
  private List<AirlineSettings> airlines = defaultAirlines();

  public Loops getLoops() {
    return loops;
  }

  public Injection getInjection() {
    return injection;
  }

  public Fines getFines() {
    return fines;
  }

  public Billing getBilling() {
    return billing;
  }

  public double getDurationSeconds() {
    return durationSeconds;
  }

  public void setDurationSeconds(double durationSeconds) {
    this.durationSeconds = durationSeconds;
  }

  public double getTimeScale() {
    return timeScale;
  }

  public void setTimeScale(double timeScale) {
    this.timeScale = timeScale;
  }

  public double getMaxTickSeconds() {
    return maxTickSeconds;
  }

  public void setMaxTickSeconds(double maxTickSeconds) {
    this.maxTickSeconds = maxTickSeconds;
  }

  public boolean isAutostart() {
    return autostart;
  }

  public void setAutostart(boolean autostart) {
    this.autostart = autostart;
  }

  public Long getRandomSeed() {
    return randomSeed;
  }

  public void setRandomSeed(Long randomSeed) {
    this.randomSeed = randomSeed;
  }

  public int getDeniedRetryBudget() {
    return deniedRetryBudget;
  }

  public void setDeniedRetryBudget(int deniedRetryBudget) {
    this.deniedRetryBudget = deniedRetryBudget;
  }

  public boolean isAllowCommercialOverflow() {
    return allowCommercialOverflow;
  }

  public void setAllowCommercialOverflow(boolean allowCommercialOverflow) {
    this.allowCommercialOverflow = allowCommercialOverflow;
  }

  public int getCargoShortfallWarnCycles() {
    return cargoShortfallWarnCycles;
  }

  public void setCargoShortfallWarnCycles(int cargoShortfallWarnCycles) {
    this.cargoShortfallWarnCycles = cargoShortfallWarnCycles;
  }

  public double getRetentionSeconds() {
    return retentionSeconds;
  }

  public void setRetentionSeconds(double retentionSeconds) {
    this.retentionSeconds = retentionSeconds;
  }

  public double getGroundFaultProbability() {
    return groundFaultProbability;
  }

  public void setGroundFaultProbability(double groundFaultProbability) {
    this.groundFaultProbability = groundFaultProbability;
  }

  public boolean isSeedInitialFlights() {
    return seedInitialFlights;
  }

  public void setSeedInitialFlights(boolean seedInitialFlights) {
    this.seedInitialFlights = seedInitialFlights;
  }

  public double getInitialFlightSpacingSeconds() {
    return initialFlightSpacingSeconds;
  }

  public void setInitialFlightSpacingSeconds(double initialFlightSpacingSeconds) {
    this.initialFlightSpacingSeconds = initialFlightSpacingSeconds;
  }

  public Map<Direction, DirectionSettings> getDirections() {
    return directions;
  }

  public void setDirections(Map<Direction, DirectionSettings> directions) {
    this.directions = directions;
  }

  public Map<FlightPhase, EnvelopeSettings> getEnvelopes() {
    return envelopes;
  }

  public void setEnvelopes(Map<FlightPhase, EnvelopeSettings> envelopes) {
    this.envelopes = envelopes;
  }

  public List<AirlineSettings> getAirlines() {
    return airlines;
  }

  public void setAirlines(List<AirlineSettings> airlines) {
    this.airlines = airlines;
  }

  private static Map<Direction, DirectionSettings> defaultDirections() {
    Map<Direction, DirectionSettings> table = new LinkedHashMap<>();
    table.put(Direction.NORTH, new DirectionSettings(180, 0.10));
    table.put(Direction.SOUTH, new DirectionSettings(120, 0.05));
    table.put(Direction.EAST, new DirectionSettings(150, 0.15));
    table.put(Direction.WEST, new DirectionSettings(240, 0.20));
    return table;
  }

  private static Map<FlightPhase, EnvelopeSettings> defaultEnvelopes() {
    Map<FlightPhase, EnvelopeSettings> table = new LinkedHashMap<>();
    table.put(FlightPhase.HOLDING, new EnvelopeSettings(400, 600));
    table.put(FlightPhase.APPROACH, new EnvelopeSettings(240, 290));
    table.put(FlightPhase.LANDING, new EnvelopeSettings(30, 240));
    table.put(FlightPhase.TAXI_IN, new EnvelopeSettings(15, 30));
    table.put(FlightPhase.AT_GATE_ARRIVAL, new EnvelopeSettings(0, 5));
    table.put(FlightPhase.AT_GATE_DEPARTURE, new EnvelopeSettings(0, 5));
    table.put(FlightPhase.TAXI_OUT, new EnvelopeSettings(15, 30));
    table.put(FlightPhase.TAKEOFF_ROLL, new EnvelopeSettings(0, 290));
    table.put(FlightPhase.CLIMB, new EnvelopeSettings(250, 463));
    table.put(FlightPhase.CRUISE, new EnvelopeSettings(800, 900));
    return table;
  }

  private static List<AirlineSettings> defaultAirlines() {
    List<AirlineSettings> roster = new ArrayList<>();
    roster.add(new AirlineSettings("PIA", "PK", AircraftCategory.COMMERCIAL, 6, 4));
    roster.add(new AirlineSettings("AirBlue", "PA", AircraftCategory.COMMERCIAL, 4, 4));
    roster.add(new AirlineSettings("FedEx", "FX", AircraftCategory.CARGO, 3, 2));
    roster.add(new AirlineSettings("Pakistan Airforce", "PAF", AircraftCategory.EMERGENCY, 2, 1));
    roster.add(new AirlineSettings("Blue Dart", "BD", AircraftCategory.CARGO, 2, 2));
    roster.add(new AirlineSettings("AghaKhan Air", "AKA", AircraftCategory.EMERGENCY, 2, 1));
    return roster;
  }

  /** Sleep between iterations of each worker loop. */
  public static class Loops {
    private long timeAdvanceMs = 100;
    private long generationMs = 100;
    private long monitoringMs = 200;
    private long retryMs = 500;
    private long joinTimeoutMs = 5000;

    public long getTimeAdvanceMs() {
      return timeAdvanceMs;
    }

    public void setTimeAdvanceMs(long timeAdvanceMs) {
      this.timeAdvanceMs = timeAdvanceMs;
    }

    public long getGenerationMs() {
      return generationMs;
    }

    public void setGenerationMs(long generationMs) {
      this.generationMs = generationMs;
    }

    public long getMonitoringMs() {
      return monitoringMs;
    }

    public void setMonitoringMs(long monitoringMs) {
      this.monitoringMs = monitoringMs;
    }

    public long getRetryMs() {
      return retryMs;
    }

    public void setRetryMs(long retryMs) {
      this.retryMs = retryMs;
    }

    public long getJoinTimeoutMs() {
      return joinTimeoutMs;
    }

    public void setJoinTimeoutMs(long joinTimeoutMs) {
      this.joinTimeoutMs = joinTimeoutMs;
    }
  }

  /** Out-of-envelope speed injection. */
  public static class Injection {
    private double probability = 0.15;
    private double minExcess = 5;
    private double maxExcess = 40;

    public double getProbability() {
      return probability;
    }

    public void setProbability(double probability) {
      this.probability = probability;
    }

    public double getMinExcess() {
      return minExcess;
    }

    public void setMinExcess(double minExcess) {
      this.minExcess = minExcess;
    }

    public double getMaxExcess() {
      return maxExcess;
    }

    public void setMaxExcess(double maxExcess) {
      this.maxExcess = maxExcess;
    }
  }

  /** Per-violation fees used for airline fine totals. */
  public static class Fines {
    private long base = 1000;
    private long severe = 5000;
    private double severeDeviation = 100;

    public long getBase() {
      return base;
    }

    public void setBase(long base) {
      this.base = base;
    }

    public long getSevere() {
      return severe;
    }

    public void setSevere(long severe) {
      this.severe = severe;
    }

    public double getSevereDeviation() {
      return severeDeviation;
    }

    public void setSevereDeviation(double severeDeviation) {
      this.severeDeviation = severeDeviation;
    }
  }

  /** AVN fine schedule and optional Redis event feed. */
  public static class Billing {
    private final Redis redis = new Redis();
    private long commercialFine = 500_000;
    private long cargoFine = 700_000;
    private double serviceFeeRate = 0.15;
    private long dueDays = 3;
    private long overdueSweepMs = 60_000;

    public Redis getRedis() {
      return redis;
    }

    public long getCommercialFine() {
      return commercialFine;
    }

    public void setCommercialFine(long commercialFine) {
      this.commercialFine = commercialFine;
    }

    public long getCargoFine() {
      return cargoFine;
    }

    public void setCargoFine(long cargoFine) {
      this.cargoFine = cargoFine;
    }

    public double getServiceFeeRate() {
      return serviceFeeRate;
    }

    public void setServiceFeeRate(double serviceFeeRate) {
      this.serviceFeeRate = serviceFeeRate;
    }

    public long getDueDays() {
      return dueDays;
    }

    public void setDueDays(long dueDays) {
      this.dueDays = dueDays;
    }

    public long getOverdueSweepMs() {
      return overdueSweepMs;
    }

    public void setOverdueSweepMs(long overdueSweepMs) {
      this.overdueSweepMs = overdueSweepMs;
    }

    public static class Redis {
      private boolean enabled = false;
      private String key = "aircontrol:notices:events";

      public boolean isEnabled() {
        return enabled;
      }

      public void setEnabled(boolean enabled) {
        this.enabled = enabled;
      }

      public String getKey() {
        return key;
      }

      public void setKey(String key) {
        this.key = key;
      }
    }
  }

  /** Generation interval and emergency odds for one direction. */
  public static class DirectionSettings {
    private double intervalSeconds;
    private double emergencyProbability;

    public DirectionSettings() {}

    public DirectionSettings(double intervalSeconds, double emergencyProbability) {
      this.intervalSeconds = intervalSeconds;
      this.emergencyProbability = emergencyProbability;
    }

    public double getIntervalSeconds() {
      return intervalSeconds;
    }

    public void setIntervalSeconds(double intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
    }

    public double getEmergencyProbability() {
      return emergencyProbability;
    }

    public void setEmergencyProbability(double emergencyProbability) {
      this.emergencyProbability = emergencyProbability;
    }
  }

  public static class EnvelopeSettings {
    private double min;
    private double max;

    public EnvelopeSettings() {}

    public EnvelopeSettings(double min, double max) {
      this.min = min;
      this.max = max;
    }

    public double getMin() {
      return min;
    }

    public void setMin(double min) {
      this.min = min;
    }

    public double getMax() {
      return max;
    }

    public void setMax(double max) {
      this.max = max;
    }
  }

  public static class AirlineSettings {
    private String name;
    private String code;
    private AircraftCategory primaryCategory = AircraftCategory.COMMERCIAL;
    private int totalAircraft;
    private int initialActiveFlights;

    public AirlineSettings() {}

    public AirlineSettings(
        String name,
        String code,
        AircraftCategory primaryCategory,
        int totalAircraft,
        int initialActiveFlights) {
      this.name = name;
      this.code = code;
      this.primaryCategory = primaryCategory;
      this.totalAircraft = totalAircraft;
      this.initialActiveFlights = initialActiveFlights;
    }

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public String getCode() {
      return code;
    }

    public void setCode(String code) {
      this.code = code;
    }

    public AircraftCategory getPrimaryCategory() {
      return primaryCategory;
    }

    public void setPrimaryCategory(AircraftCategory primaryCategory) {
      this.primaryCategory = primaryCategory;
    }

    public int getTotalAircraft() {
      return totalAircraft;
    }

    public void setTotalAircraft(int totalAircraft) {
      this.totalAircraft = totalAircraft;
    }

    public int getInitialActiveFlights() {
      return initialActiveFlights;
    }

    public void setInitialActiveFlights(int initialActiveFlights) {
      this.initialActiveFlights = initialActiveFlights;
    }
  }
}
