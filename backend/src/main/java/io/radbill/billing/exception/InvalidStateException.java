package io.radbill.billing.exception;

public class InvalidStateException extends BillingException {

  public InvalidStateException(String title, String detail) {
    super(title, detail);
  }

  @Override
  public ErrorCategory getCategory() {
    return ErrorCategory.STATE;
  }
}
