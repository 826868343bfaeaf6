package io.radbill.billing.exception;

public class ResourceNotFoundException extends BillingException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        resourceType + " not found",
        "No " + resourceType.toLowerCase() + " found with id " + id);
  }

  protected ResourceNotFoundException(String title, String detail, boolean withDetail) {
    super(title, detail);
  }

  public static ResourceNotFoundException withDetail(String title, String detail) {
    return new ResourceNotFoundException(title, detail, true);
  }

  @Override
  public ErrorCategory getCategory() {
    return ErrorCategory.NOT_FOUND;
  }
}
