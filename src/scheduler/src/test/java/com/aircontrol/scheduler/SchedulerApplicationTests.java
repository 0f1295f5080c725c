package com.aircontrol.scheduler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import com.aircontrol.scheduler.scheduler.SchedulerOrchestrator;
import com.aircontrol.scheduler.scheduler.SimulationState;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest(
    properties = {
      "scheduler.autostart=false",
      "scheduler.scheduling.enabled=false"
    })
class SchedulerApplicationTests {
  @Autowired
  private ApplicationContext applicationContext;

  @Autowired
  private SchedulerOrchestrator orchestrator;

  @Test
  void contextLoads() {
    assertNotNull(applicationContext);
    assertEquals(SimulationState.INITIALIZED, orchestrator.state());
  }
}
