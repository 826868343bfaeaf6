package io.radbill.billing.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record PaymentRecordedEvent(
    UUID invoiceId,
    UUID paymentId,
    BigDecimal amount,
    String currency,
    String paymentStatus,
    String invoiceStatus,
    Instant occurredAt)
    implements InvoiceEvent {

  @Override
  public String eventType() {
    return "payment.recorded";
  }

  @Override
  public Map<String, Object> details() {
    return Map.of(
        "payment_id", paymentId.toString(),
        "amount", amount.toPlainString(),
        "currency", currency,
        "payment_status", paymentStatus,
        "invoice_status", invoiceStatus);
  }
}
