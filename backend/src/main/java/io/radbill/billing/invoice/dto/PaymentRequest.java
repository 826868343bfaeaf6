package io.radbill.billing.invoice.dto;

import io.radbill.billing.invoice.PaymentMethod;
import io.radbill.billing.invoice.PaymentStatus;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * A payment to record against an invoice. The invoice also rejects amounts finer than the minor
 * unit of its currency.
 *
 * @param currency defaults to the invoice currency when null
 * @param status PENDING or COMPLETED; defaults to COMPLETED when null
 * @param paidAt defaults to now when null
 */
public record PaymentRequest(
    @NotNull @Positive @Digits(integer = 15, fraction = 2) BigDecimal amount,
    @Size(min = 3, max = 3) String currency,
    @NotNull PaymentMethod method,
    @Size(max = 255) String transactionRef,
    PaymentStatus status,
    Instant paidAt,
    String notes) {

  public static PaymentRequest completed(
      BigDecimal amount, PaymentMethod method, String transactionRef) {
    return new PaymentRequest(amount, null, method, transactionRef, null, null, null);
  }
}
