package io.radbill.billing.exception;

public class ValidationException extends BillingException {

  public ValidationException(String title, String detail) {
    super(title, detail);
  }

  @Override
  public ErrorCategory getCategory() {
    return ErrorCategory.VALIDATION;
  }
}
