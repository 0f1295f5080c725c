package com.aircontrol.scheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot entrypoint for the traffic scheduler.
 *
 * <p>The service runs the airport simulation, exposes its state and controls over HTTP, and keeps
 * the AVN ledger for speed violations.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SchedulerApplication {
  /**
   * Starts the scheduler application.
   *
   * @param args CLI arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(SchedulerApplication.class, args);
  }

  @Configuration(proxyBeanMethods = false)
  @EnableScheduling
  @ConditionalOnProperty(
      prefix = "scheduler.scheduling",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  static class SchedulingConfiguration {}
}
