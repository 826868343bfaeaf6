package io.radbill.billing.invoice;

import java.math.BigDecimal;

/** Projection row of a per-currency sum. */
public record CurrencyAmount(String currency, BigDecimal amount) {}
