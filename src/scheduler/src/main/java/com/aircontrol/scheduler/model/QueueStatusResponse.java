package com.aircontrol.scheduler.model;

import java.util.List;

/** Response contract for {@code GET /api/queues}. */
public record QueueStatusResponse(
    int deniedDepth,
    List<String> deniedFlightIds,
    int scheduled,
    int active,
    int emergency,
    String timestamp) {}
