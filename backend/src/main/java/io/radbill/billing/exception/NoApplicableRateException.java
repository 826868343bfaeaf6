package io.radbill.billing.exception;

import java.time.LocalDate;

public class NoApplicableRateException extends ResourceNotFoundException {

  public NoApplicableRateException(String planName, Object rateType, LocalDate date) {
    super(
        "No applicable rate",
        "Billing plan '" + planName + "' has no " + rateType + " rate effective on " + date,
        true);
  }
}
