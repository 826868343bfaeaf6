package io.radbill.billing.exception;

public class RateConflictException extends ConsistencyException {

  public RateConflictException(String detail) {
    super("Overlapping rate", detail);
  }
}
