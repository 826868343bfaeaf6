package io.radbill.billing.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record PaymentFailedEvent(UUID invoiceId, UUID paymentId, String reason, Instant occurredAt)
    implements InvoiceEvent {

  @Override
  public String eventType() {
    return "payment.failed";
  }

  @Override
  public Map<String, Object> details() {
    return Map.of("payment_id", paymentId.toString(), "reason", reason);
  }
}
