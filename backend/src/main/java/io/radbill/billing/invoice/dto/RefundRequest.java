package io.radbill.billing.invoice.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;

/**
 * A refund of a completed payment.
 *
 * @param amount refunds what is left of the payment when null
 */
public record RefundRequest(
    @Positive @Digits(integer = 15, fraction = 2) BigDecimal amount, @NotBlank String reason) {

  public static RefundRequest full(String reason) {
    return new RefundRequest(null, reason);
  }
}
