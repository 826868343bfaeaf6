package io.radbill.billing.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record PaymentRefundedEvent(
    UUID invoiceId,
    UUID paymentId,
    String refundNumber,
    BigDecimal amount,
    BigDecimal paymentRemaining,
    String reason,
    String invoiceStatus,
    Instant occurredAt)
    implements InvoiceEvent {

  @Override
  public String eventType() {
    return "payment.refunded";
  }

  @Override
  public Map<String, Object> details() {
    return Map.of(
        "payment_id", paymentId.toString(),
        "refund_number", refundNumber,
        "amount", amount.toPlainString(),
        "payment_remaining", paymentRemaining.toPlainString(),
        "reason", reason,
        "invoice_status", invoiceStatus);
  }
}
