package io.radbill.billing.invoice.dto;

import io.radbill.billing.invoice.Payment;
import io.radbill.billing.invoice.PaymentMethod;
import io.radbill.billing.invoice.PaymentStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record PaymentResponse(
    UUID id,
    UUID invoiceId,
    String paymentNumber,
    BigDecimal amount,
    String currency,
    PaymentMethod method,
    String transactionRef,
    PaymentStatus status,
    Instant paidAt,
    String notes,
    String statusReason,
    BigDecimal refundedAmount,
    List<RefundResponse> refunds) {

  public static PaymentResponse from(UUID invoiceId, Payment payment) {
    return new PaymentResponse(
        payment.getId(),
        invoiceId,
        payment.getPaymentNumber(),
        payment.getAmount(),
        payment.getCurrency(),
        payment.getMethod(),
        payment.getTransactionRef(),
        payment.getStatus(),
        payment.getPaidAt(),
        payment.getNotes(),
        payment.getStatusReason(),
        payment.getRefundedAmount(),
        payment.getRefunds().stream().map(RefundResponse::from).toList());
  }
}
