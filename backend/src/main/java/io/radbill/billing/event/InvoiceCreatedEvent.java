package io.radbill.billing.event;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

public record InvoiceCreatedEvent(
    UUID invoiceId,
    String userId,
    LocalDate periodStart,
    LocalDate periodEnd,
    String currency,
    Instant occurredAt)
    implements InvoiceEvent {

  @Override
  public String eventType() {
    return "invoice.created";
  }

  @Override
  public Map<String, Object> details() {
    return Map.of(
        "user_id", userId,
        "period_start", periodStart.toString(),
        "period_end", periodEnd.toString(),
        "currency", currency);
  }
}
