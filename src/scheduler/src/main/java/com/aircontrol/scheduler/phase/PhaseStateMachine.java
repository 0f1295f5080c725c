package com.aircontrol.scheduler.phase;

import java.util.Random;

/**
 * Per-aircraft phase and speed state.
 *
 * <p>The machine walks one {@link PhaseSequence} strictly in order. Speed is sampled on phase entry
 * and then shaped by the phase's {@link SpeedProfile} as the phase progresses. An injected hold
 * pins the speed to a given value until the next advance.
 *
 * <p>Not thread-safe: the owning flight serializes every call.
 */
public class PhaseStateMachine {
  private final PhaseSequence sequence;
  private final SpeedEnvelopeTable envelopes;
  private final Random random;
  private FlightPhase phase;
  private double entrySpeed;
  private double speed;
  private Double heldSpeed;

  public PhaseStateMachine(PhaseSequence sequence, SpeedEnvelopeTable envelopes, Random random) {
    this.sequence = sequence;
    this.envelopes = envelopes;
    this.random = random;
    this.phase = sequence.initialPhase();
    enterPhase();
  }

  public PhaseSequence sequence() {
    return sequence;
  }

  public FlightPhase phase() {
    return phase;
  }

  public double speed() {
    return speed;
  }

  public SpeedEnvelope envelope() {
    return envelopes.forPhase(phase);
  }

  public boolean isTerminal() {
    return sequence.isTerminal(phase);
  }

  public boolean isHolding() {
    return heldSpeed != null;
  }

  /**
   * Moves to the next phase of the sequence, dropping any hold and resampling speed.
   *
   * @return the new phase
   * @throws InvalidTransitionException when the current phase is terminal
   */
  public FlightPhase advance() {
    phase = sequence.next(phase);
    heldSpeed = null;
    enterPhase();
    return phase;
  }

  /**
   * Advances only if {@code target} is the immediate successor of the current phase.
   *
   * @throws InvalidTransitionException when {@code target} would skip or revisit a phase
   */
  public FlightPhase advanceTo(FlightPhase target) {
    FlightPhase expected = sequence.next(phase);
    if (expected != target) {
      throw new InvalidTransitionException(
          "Cannot move from " + phase + " to " + target + ", expected " + expected);
    }
    return advance();
  }

  /**
   * Updates speed for the given completion fraction of the current phase.
   *
   * @param fraction elapsed share of the phase, clamped to {@code [0, 1]}
   */
  public void progress(double fraction) {
    if (heldSpeed != null) {
      speed = heldSpeed;
      return;
    }
    double f = Math.max(0.0, Math.min(1.0, fraction));
    SpeedEnvelope envelope = envelope();
    switch (SpeedProfile.forPhase(phase)) {
      case DECAY -> speed = entrySpeed - (entrySpeed - envelope.min()) * f;
      case RAMP -> speed = envelope.min() + (envelope.max() - envelope.min()) * f;
      case CONSTANT -> speed = entrySpeed;
    }
  }

  /** Pins the speed until the next advance, overriding the phase profile. */
  public void hold(double pinnedSpeed) {
    this.heldSpeed = pinnedSpeed;
    this.speed = pinnedSpeed;
  }

  public boolean isSpeedValid() {
    return envelope().contains(speed);
  }

  private void enterPhase() {
    SpeedEnvelope envelope = envelope();
    if (SpeedProfile.forPhase(phase) == SpeedProfile.RAMP) {
      entrySpeed = envelope.min();
    } else {
      entrySpeed = envelope.min() + random.nextDouble() * (envelope.max() - envelope.min());
    }
    speed = entrySpeed;
  }
}
