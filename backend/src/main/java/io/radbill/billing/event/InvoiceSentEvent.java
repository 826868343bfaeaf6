package io.radbill.billing.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

public record InvoiceSentEvent(
    UUID invoiceId,
    String userId,
    String invoiceNumber,
    BigDecimal totalAmount,
    String currency,
    LocalDate dueDate,
    Instant occurredAt)
    implements InvoiceEvent {

  @Override
  public String eventType() {
    return "invoice.sent";
  }

  @Override
  public Map<String, Object> details() {
    return Map.of(
        "user_id", userId,
        "invoice_number", invoiceNumber,
        "total_amount", totalAmount.toPlainString(),
        "currency", currency,
        "due_date", dueDate.toString());
  }
}
