package io.radbill.billing.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record PaymentCompletedEvent(
    UUID invoiceId, UUID paymentId, BigDecimal amount, String invoiceStatus, Instant occurredAt)
    implements InvoiceEvent {

  @Override
  public String eventType() {
    return "payment.completed";
  }

  @Override
  public Map<String, Object> details() {
    return Map.of(
        "payment_id", paymentId.toString(),
        "amount", amount.toPlainString(),
        "invoice_status", invoiceStatus);
  }
}
