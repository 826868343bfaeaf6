package io.radbill.billing.exception;

public class CurrencyMismatchException extends ConsistencyException {

  public CurrencyMismatchException(String expected, String actual) {
    super("Currency mismatch", "Expected currency " + expected + " but got " + actual);
  }
}
