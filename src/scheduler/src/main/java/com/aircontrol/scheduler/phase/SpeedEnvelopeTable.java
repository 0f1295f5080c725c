package com.aircontrol.scheduler.phase;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Immutable lookup of the speed envelope for every {@link FlightPhase}. */
public final class SpeedEnvelopeTable {
  private final Map<FlightPhase, SpeedEnvelope> envelopes;

  /**
   * Creates the table.
   *
   * @param envelopes one envelope per phase; every phase must be present
   * @throws IllegalArgumentException when a phase has no envelope
   */
  public SpeedEnvelopeTable(Map<FlightPhase, SpeedEnvelope> envelopes) {
    EnumMap<FlightPhase, SpeedEnvelope> copy = new EnumMap<>(FlightPhase.class);
    copy.putAll(envelopes);
    for (FlightPhase phase : FlightPhase.values()) {
      if (!copy.containsKey(phase)) {
        throw new IllegalArgumentException("scheduler.envelopes." + phase + " is missing");
      }
    }
    this.envelopes = Collections.unmodifiableMap(copy);
  }

  /** Envelope table used when nothing overrides it. */
  public static SpeedEnvelopeTable defaults() {
    EnumMap<FlightPhase, SpeedEnvelope> table = new EnumMap<>(FlightPhase.class);
    table.put(FlightPhase.HOLDING, new SpeedEnvelope(400, 600));
    table.put(FlightPhase.APPROACH, new SpeedEnvelope(240, 290));
    table.put(FlightPhase.LANDING, new SpeedEnvelope(30, 240));
    table.put(FlightPhase.TAXI_IN, new SpeedEnvelope(15, 30));
    table.put(FlightPhase.AT_GATE_ARRIVAL, new SpeedEnvelope(0, 5));
    table.put(FlightPhase.AT_GATE_DEPARTURE, new SpeedEnvelope(0, 5));
    table.put(FlightPhase.TAXI_OUT, new SpeedEnvelope(15, 30));
    table.put(FlightPhase.TAKEOFF_ROLL, new SpeedEnvelope(0, 290));
    table.put(FlightPhase.CLIMB, new SpeedEnvelope(250, 463));
    table.put(FlightPhase.CRUISE, new SpeedEnvelope(800, 900));
    return new SpeedEnvelopeTable(table);
  }

  public SpeedEnvelope forPhase(FlightPhase phase) {
    return envelopes.get(phase);
  }

  public Map<FlightPhase, SpeedEnvelope> asMap() {
    return envelopes;
  }
}
