package io.radbill.billing.exception;

public class ResourceConflictException extends ConsistencyException {

  public ResourceConflictException(String title, String detail) {
    super(title, detail);
  }

  public ResourceConflictException(String title, String detail, Throwable cause) {
    super(title, detail, cause);
  }
}
