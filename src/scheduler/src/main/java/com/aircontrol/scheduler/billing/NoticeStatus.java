package com.aircontrol.scheduler.billing;

public enum NoticeStatus {
  UNPAID,
  PAID,
  OVERDUE
}
