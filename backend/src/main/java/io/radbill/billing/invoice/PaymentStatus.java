package io.radbill.billing.invoice;

public enum PaymentStatus {
  PENDING,
  COMPLETED,
  FAILED,
  CANCELLED,
  REFUNDED;

  /** Pending and completed payments both count against the invoice total. */
  public boolean isCommitted() {
    return this == PENDING || this == COMPLETED;
  }
}
