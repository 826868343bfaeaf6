package io.radbill.billing.invoice.dto;

import io.radbill.billing.invoice.InvoiceItem;
import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

public record InvoiceItemResponse(
    UUID id,
    String description,
    BigDecimal quantity,
    BigDecimal unitPrice,
    BigDecimal amount,
    BigDecimal taxAmount,
    Map<String, Object> billingDetails,
    int sortOrder) {

  public static InvoiceItemResponse from(InvoiceItem item) {
    return new InvoiceItemResponse(
        item.getId(),
        item.getDescription(),
        item.getQuantity(),
        item.getUnitPrice(),
        item.getAmount(),
        item.getTaxAmount(),
        item.getBillingDetails() != null ? Map.copyOf(item.getBillingDetails()) : Map.of(),
        item.getSortOrder());
  }
}
