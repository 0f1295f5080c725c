package com.aircontrol.scheduler.billing;

/** Boundary to the billing side: turns a violation into a payable notice. */
public interface NoticeIssuer {
  /**
   * Issues a notice for one violation.
   *
   * @param request violation details
   * @return identifier of the issued notice
   */
  String issueNotice(NoticeRequest request);
}
