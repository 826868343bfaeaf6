package io.radbill.billing.exception;

public class MissingRateException extends ResourceNotFoundException {

  public MissingRateException(String planName, Object rateType) {
    super(
        "Missing rate",
        "Billing plan '" + planName + "' has no " + rateType + " rate configured",
        true);
  }
}
