package com.aircontrol.scheduler.runway;

/** Point-in-time view of a runway, safe to hand out of the lock. */
public record RunwaySnapshot(
    RunwayId id,
    RunwayStatus status,
    String occupantId,
    long usageCount,
    double usageSeconds) {}
