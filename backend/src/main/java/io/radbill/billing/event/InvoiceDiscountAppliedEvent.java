package io.radbill.billing.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record InvoiceDiscountAppliedEvent(
    UUID invoiceId, BigDecimal discountAmount, BigDecimal totalAmount, Instant occurredAt)
    implements InvoiceEvent {

  @Override
  public String eventType() {
    return "invoice.discount_applied";
  }

  @Override
  public Map<String, Object> details() {
    return Map.of(
        "discount_amount",
        discountAmount.toPlainString(),
        "total_amount",
        totalAmount.toPlainString());
  }
}
