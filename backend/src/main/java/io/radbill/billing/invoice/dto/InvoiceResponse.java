package io.radbill.billing.invoice.dto;

import io.radbill.billing.invoice.Invoice;
import io.radbill.billing.invoice.InvoiceStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/** Immutable snapshot of an invoice, built inside the transaction that loaded it. */
public record InvoiceResponse(
    UUID id,
    String invoiceNumber,
    String userId,
    LocalDate periodStart,
    LocalDate periodEnd,
    InvoiceStatus status,
    String currency,
    BigDecimal subtotal,
    BigDecimal discountAmount,
    BigDecimal taxAmount,
    BigDecimal totalAmount,
    BigDecimal amountPaid,
    BigDecimal balanceDue,
    BigDecimal refundDue,
    LocalDate issueDate,
    LocalDate dueDate,
    boolean overdue,
    String voidReason,
    Instant createdAt,
    Instant updatedAt,
    List<InvoiceItemResponse> items,
    List<PaymentResponse> payments) {

  public static InvoiceResponse from(Invoice invoice, LocalDate today) {
    return new InvoiceResponse(
        invoice.getId(),
        invoice.getInvoiceNumber(),
        invoice.getUserId(),
        invoice.getPeriod().start(),
        invoice.getPeriod().end(),
        invoice.getStatus(),
        invoice.getCurrency(),
        invoice.getSubtotal(),
        invoice.getDiscountAmount(),
        invoice.getTaxAmount(),
        invoice.getTotalAmount(),
        invoice.completedPayments().amount(),
        invoice.getBalanceDue().amount(),
        invoice.getRefundDue().amount(),
        invoice.getIssueDate(),
        invoice.getDueDate(),
        invoice.isOverdue(today),
        invoice.getVoidReason(),
        invoice.getCreatedAt(),
        invoice.getUpdatedAt(),
        invoice.getItems().stream().map(InvoiceItemResponse::from).toList(),
        invoice.getPayments().stream()
            .map(p -> PaymentResponse.from(invoice.getId(), p))
            .toList());
  }
}
