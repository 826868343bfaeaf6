package io.radbill.billing.exception;

/** A requested change would break a financial or configuration invariant. */
public class ConsistencyException extends BillingException {

  public ConsistencyException(String title, String detail) {
    super(title, detail);
  }

  public ConsistencyException(String title, String detail, Throwable cause) {
    super(title, detail, cause);
  }

  @Override
  public ErrorCategory getCategory() {
    return ErrorCategory.CONSISTENCY;
  }
}
