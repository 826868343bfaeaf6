package io.radbill.billing.invoice.dto;

import io.radbill.billing.invoice.Refund;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record RefundResponse(
    UUID id,
    UUID paymentId,
    String refundNumber,
    BigDecimal amount,
    String currency,
    String reason,
    Instant refundedAt) {

  public static RefundResponse from(Refund refund) {
    return new RefundResponse(
        refund.getId(),
        refund.getPaymentId(),
        refund.getRefundNumber(),
        refund.getAmount(),
        refund.getCurrency(),
        refund.getReason(),
        refund.getRefundedAt());
  }
}
