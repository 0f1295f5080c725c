package com.aircontrol.scheduler.billing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class NoticeOverdueJob {
  private static final Logger log = LoggerFactory.getLogger(NoticeOverdueJob.class);

  private final NoticeLedger ledger;

  public NoticeOverdueJob(NoticeLedger ledger) {
    this.ledger = ledger;
  }

  @Scheduled(fixedDelayString = "${scheduler.billing.overdue-sweep-ms:60000}")
  public void sweep() {
    try {
      int changed = ledger.markOverdue();
      if (changed > 0) {
        log.info("Marked {} notices overdue", changed);
      }
    } catch (RuntimeException ex) {
      // Keep the scheduler running even if a sweep fails.
      log.error("Overdue sweep failed", ex);
    }
  }
}
