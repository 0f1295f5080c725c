package com.aircontrol.scheduler.model;

import com.aircontrol.scheduler.runway.RunwaySnapshot;
import java.util.List;

/** Response contract for {@code GET /api/runways}. */
public record RunwayListResponse(
    List<RunwaySnapshot> runways, boolean commercialOverflow, String timestamp) {}
