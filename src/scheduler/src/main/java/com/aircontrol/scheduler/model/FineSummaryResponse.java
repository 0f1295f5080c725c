package com.aircontrol.scheduler.model;

/** Response contract for {@code GET /api/violations/fines/{airline}}. */
public record FineSummaryResponse(String airline, int violations, long totalFines) {}
