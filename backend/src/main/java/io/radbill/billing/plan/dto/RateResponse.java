package io.radbill.billing.plan.dto;

import io.radbill.billing.rate.Rate;
import io.radbill.billing.rate.RateTier;
import io.radbill.billing.rate.RateType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record RateResponse(
    UUID id,
    String name,
    RateType rateType,
    BigDecimal unitPrice,
    Long unitSize,
    List<RateTier> tiers,
    String currency,
    LocalDate effectiveFrom,
    LocalDate effectiveTo) {

  public static RateResponse from(Rate rate) {
    return new RateResponse(
        rate.getId(),
        rate.getName(),
        rate.getRateType(),
        rate.getUnitPrice(),
        rate.getUnitSize(),
        rate.sortedTiers(),
        rate.getCurrency(),
        rate.getEffectiveFrom(),
        rate.getEffectiveTo());
  }
}
