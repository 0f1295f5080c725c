package com.aircontrol.scheduler.api;

/** Invalid request parameter or body; mapped to HTTP 400. */
public class BadRequestException extends RuntimeException {
  public BadRequestException(String message) {
    super(message);
  }
}
