package com.aircontrol.scheduler.model;

import com.aircontrol.scheduler.flight.FlightSnapshot;
import java.util.List;

/**
 * Response contract for {@code GET /api/flights}.
 *
 * @param items flights in registration order
 * @param count number of returned items
 * @param timestamp response generation timestamp
 */
public record FlightListResponse(List<FlightSnapshot> items, int count, String timestamp) {}
