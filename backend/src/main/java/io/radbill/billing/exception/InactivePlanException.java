package io.radbill.billing.exception;

public class InactivePlanException extends InvalidStateException {

  public InactivePlanException(String planName) {
    super("Inactive billing plan", "Billing plan '" + planName + "' is deactivated");
  }
}
