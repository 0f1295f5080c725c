package com.aircontrol.scheduler.billing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.aircontrol.scheduler.config.SchedulerProperties;
import com.aircontrol.scheduler.flight.AircraftCategory;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class RedisNoticePublisherIntegrationTest {

  @Container
  private static final GenericContainer<?> REDIS =
      new GenericContainer<>("redis:7.2-alpine").withExposedPorts(6379);

  private static LettuceConnectionFactory connectionFactory;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private StringRedisTemplate redisTemplate;

  @BeforeAll
  static void setupRedis() {
    RedisStandaloneConfiguration config =
        new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379));
    connectionFactory = new LettuceConnectionFactory(config);
    connectionFactory.afterPropertiesSet();
  }

  @AfterAll
  static void shutdownRedis() {
    if (connectionFactory != null) {
      connectionFactory.destroy();
    }
  }

  @BeforeEach
  void clearRedis() {
    redisTemplate = new StringRedisTemplate(connectionFactory);
    redisTemplate.afterPropertiesSet();
    try (RedisConnection connection = connectionFactory.getConnection()) {
      connection.serverCommands().flushAll();
    }
  }

  @Test
  void publish_writesNoticeEventToConfiguredList() throws Exception {
    SchedulerProperties properties = new SchedulerProperties();
    properties.getBilling().getRedis().setKey("aircontrol:test:notices");
    RedisNoticePublisher publisher = new RedisNoticePublisher(redisTemplate, objectMapper, properties);
    Instant issuedAt = Instant.parse("2026-02-13T12:00:00Z");
    Notice notice = new Notice(
        "AVN-1000",
        "PK-AC1000",
        "PIA",
        "PK1000",
        AircraftCategory.COMMERCIAL,
        650.0,
        400.0,
        600.0,
        42.0,
        new BigDecimal("500000.00"),
        new BigDecimal("75000.00"),
        new BigDecimal("575000.00"),
        issuedAt,
        issuedAt.plusSeconds(3 * 86_400),
        NoticeStatus.UNPAID,
        null,
        null);

    assertTrue(publisher.publish("issued", notice));

    String payload = redisTemplate.opsForList().leftPop("aircontrol:test:notices");
    assertNotNull(payload);

    Map<String, Object> asMap = objectMapper.readValue(payload, new TypeReference<>() {});
    assertEquals("issued", asMap.get("event"));
    assertEquals("AVN-1000", asMap.get("notice_id"));
    assertEquals("PK-AC1000", asMap.get("aircraft_id"));
    assertEquals("PIA", asMap.get("airline"));
    assertEquals("COMMERCIAL", asMap.get("category"));
    assertEquals(650.0, ((Number) asMap.get("recorded_speed")).doubleValue());
    assertEquals("575000.00", asMap.get("total_due"));
    assertEquals("UNPAID", asMap.get("status"));
    assertEquals("2026-02-16T12:00:00Z", asMap.get("due_at"));
    assertNotNull(asMap.get("published_at"), "published_at must be stamped at publish time");
  }
}
