package io.radbill.billing.exception;

/** A collaborator call (tax, usage source) failed or did not answer in time. */
public class ExternalServiceException extends BillingException {

  public ExternalServiceException(String title, String detail, Throwable cause) {
    super(title, detail, cause);
  }

  @Override
  public ErrorCategory getCategory() {
    return ErrorCategory.EXTERNAL;
  }
}
