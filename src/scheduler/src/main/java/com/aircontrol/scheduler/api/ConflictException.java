package com.aircontrol.scheduler.api;

/**
 * Request not allowed in the current state, such as pausing a stopped simulation or paying a
 * notice twice. Mapped to HTTP 409.
 */
public class ConflictException extends RuntimeException {
  public ConflictException(String message) {
    super(message);
  }
}
