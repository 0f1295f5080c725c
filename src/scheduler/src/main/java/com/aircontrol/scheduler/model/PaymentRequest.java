package com.aircontrol.scheduler.model;

import java.math.BigDecimal;

/** Request body for {@code POST /api/notices/{id}/payments}. */
public record PaymentRequest(BigDecimal amount) {}
