package com.aircontrol.scheduler.phase;

/**
 * Raised when a phase advance is requested outside the fixed phase graph.
 *
 * <p>The orchestrator never asks for such a transition, so this signals a logic error rather than a
 * runtime condition to recover from.
 */
public class InvalidTransitionException extends IllegalStateException {
  /**
   * Creates the exception.
   *
   * @param message description of the rejected transition
   */
  public InvalidTransitionException(String message) {
    super(message);
  }
}
