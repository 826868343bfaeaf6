package io.radbill.billing.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

public record RateAddedEvent(
    UUID planId,
    String rateName,
    String rateType,
    BigDecimal unitPrice,
    String currency,
    LocalDate effectiveFrom,
    LocalDate effectiveTo,
    Instant occurredAt)
    implements BillingPlanEvent {

  @Override
  public String eventType() {
    return "billing_plan.rate_added";
  }

  @Override
  public Map<String, Object> details() {
    // effective_to is optional, so Map.of cannot be used
    var details = new HashMap<String, Object>();
    details.put("rate_name", rateName);
    details.put("rate_type", rateType);
    details.put("unit_price", unitPrice.toPlainString());
    details.put("currency", currency);
    details.put("effective_from", effectiveFrom.toString());
    details.put("effective_to", effectiveTo != null ? effectiveTo.toString() : null);
    return details;
  }
}
