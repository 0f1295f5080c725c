package com.aircontrol.scheduler.runway;

public enum RunwayStatus {
  AVAILABLE,
  IN_USE,
  MAINTENANCE,
  WEATHER_CLOSED;

  public boolean isClosed() {
    return this == MAINTENANCE || this == WEATHER_CLOSED;
  }
}
