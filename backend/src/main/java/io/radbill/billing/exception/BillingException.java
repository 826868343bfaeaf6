package io.radbill.billing.exception;

/**
 * Root of the billing failure taxonomy. Every failure carries a short {@code title} naming the
 * kind of problem and a {@code detail} describing this occurrence, so an outer layer can map it to
 * a problem response without parsing messages.
 */
public abstract class BillingException extends RuntimeException {

  private final String title;
  private final String detail;

  protected BillingException(String title, String detail) {
    this(title, detail, null);
  }

  protected BillingException(String title, String detail, Throwable cause) {
    super(title + ": " + detail, cause);
    this.title = title;
    this.detail = detail;
  }

  /** The failure category, used by callers that translate failures into responses. */
  public abstract ErrorCategory getCategory();

  public String getTitle() {
    return title;
  }

  public String getDetail() {
    return detail;
  }
}
