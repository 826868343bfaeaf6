package io.radbill.billing.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record InvoiceTaxAppliedEvent(
    UUID invoiceId, BigDecimal taxAmount, BigDecimal totalAmount, Instant occurredAt)
    implements InvoiceEvent {

  @Override
  public String eventType() {
    return "invoice.tax_applied";
  }

  @Override
  public Map<String, Object> details() {
    return Map.of(
        "tax_amount", taxAmount.toPlainString(), "total_amount", totalAmount.toPlainString());
  }
}
