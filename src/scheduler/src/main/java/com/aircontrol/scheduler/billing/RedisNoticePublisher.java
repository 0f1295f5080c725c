package com.aircontrol.scheduler.billing;

import com.aircontrol.scheduler.config.SchedulerProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/** Pushes notice lifecycle events as JSON onto a Redis list for the billing portal. */
@Component
@ConditionalOnProperty(prefix = "scheduler.billing.redis", name = "enabled", havingValue = "true")
public class RedisNoticePublisher {
  private static final Logger log = LoggerFactory.getLogger(RedisNoticePublisher.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final SchedulerProperties properties;

  public RedisNoticePublisher(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      SchedulerProperties properties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /**
   * Publishes one event.
   *
   * @return true when the payload reached Redis
   */
  public boolean publish(String eventType, Notice notice) {
    Map<String, Object> payload = new HashMap<>();
    payload.put("event", eventType);
    payload.put("notice_id", notice.id());
    payload.put("aircraft_id", notice.aircraftId());
    payload.put("airline", notice.airlineName());
    payload.put("flight_number", notice.flightNumber());
    payload.put("category", notice.category().name());
    payload.put("recorded_speed", notice.recordedSpeed());
    payload.put("min_allowed", notice.minAllowedSpeed());
    payload.put("max_allowed", notice.maxAllowedSpeed());
    payload.put("total_due", notice.totalDue().toPlainString());
    payload.put("status", notice.status().name());
    payload.put("due_at", notice.dueAt().toString());
    payload.put("published_at", Instant.now().toString());
    try {
      redisTemplate.opsForList().rightPush(
          properties.getBilling().getRedis().getKey(), objectMapper.writeValueAsString(payload));
      return true;
    } catch (JsonProcessingException ex) {
      log.warn("Failed to serialize notice event {}", notice.id(), ex);
      return false;
    }
  }
}
