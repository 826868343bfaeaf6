package io.radbill.billing.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record InvoiceItemAddedEvent(
    UUID invoiceId,
    String description,
    String strategyId,
    BigDecimal amount,
    BigDecimal totalAmount,
    Instant occurredAt)
    implements InvoiceEvent {

  @Override
  public String eventType() {
    return "invoice.item_added";
  }

  @Override
  public Map<String, Object> details() {
    return Map.of(
        "description", description,
        "strategy_id", strategyId,
        "amount", amount.toPlainString(),
        "total_amount", totalAmount.toPlainString());
  }
}
