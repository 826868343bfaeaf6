package io.radbill.billing.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** {@code refundDue} is the money received before the void that must be paid back. */
public record InvoiceVoidedEvent(
    UUID invoiceId,
    String previousStatus,
    String reason,
    BigDecimal refundDue,
    String currency,
    Instant occurredAt)
    implements InvoiceEvent {

  @Override
  public String eventType() {
    return "invoice.voided";
  }

  @Override
  public Map<String, Object> details() {
    return Map.of(
        "previous_status", previousStatus,
        "reason", reason,
        "refund_due", refundDue.toPlainString(),
        "currency", currency);
  }
}
