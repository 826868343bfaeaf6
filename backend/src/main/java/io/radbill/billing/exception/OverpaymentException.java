package io.radbill.billing.exception;

import java.math.BigDecimal;
import java.util.UUID;

public class OverpaymentException extends ConsistencyException {

  public OverpaymentException(UUID invoiceId, BigDecimal amount, BigDecimal remaining) {
    super(
        "Overpayment",
        "Payment of "
            + amount.toPlainString()
            + " exceeds the remaining "
            + remaining.toPlainString()
            + " on invoice "
            + invoiceId);
  }
}
