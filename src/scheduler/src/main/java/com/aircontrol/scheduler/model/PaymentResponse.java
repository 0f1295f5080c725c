package com.aircontrol.scheduler.model;

import com.aircontrol.scheduler.billing.NoticeStatus;
import com.aircontrol.scheduler.billing.PaymentOutcome;

/** Response contract for an accepted payment. */
public record PaymentResponse(String noticeId, PaymentOutcome outcome, NoticeStatus status) {}
