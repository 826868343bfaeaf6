package io.radbill.billing.strategy;

import io.radbill.billing.exception.ValidationException;
import io.radbill.billing.rate.Rate;
import io.radbill.billing.usage.UsageData;

/** Shared checks for the built-in strategies. */
abstract class AbstractBillingStrategy implements BillingStrategy {

  @Override
  public void validateBillingParameters(Rate rate) {
    if (rate.getRateType() != rateType()) {
      throw new ValidationException(
          "Unsupported rate type",
          "Strategy '" + strategyId() + "' prices " + rateType() + " rates, not "
              + rate.getRateType());
    }
    if (rate.getUnitPrice().signum() < 0) {
      throw new ValidationException(
          "Invalid rate price", "Rate '" + rate.getName() + "' has a negative unit price");
    }
    if (rate.getEffectiveTo() != null && rate.getEffectiveTo().isBefore(rate.getEffectiveFrom())) {
      throw new ValidationException(
          "Invalid rate window",
          "Rate '" + rate.getName() + "' expires before it becomes effective");
    }
    validateTypeSpecific(rate);
  }

  /** Hook for checks only one strategy needs. */
  protected void validateTypeSpecific(Rate rate) {}

  protected void requireValidUsage(UsageData usage) {
    if (usage == null) {
      throw new ValidationException("Missing usage", "Usage data is required");
    }
    if (usage.hasNegativeFigures()) {
      throw new ValidationException(
          "Invalid usage", "Usage for user " + usage.userId() + " contains negative figures");
    }
  }

  protected static void requirePositiveUnitSize(Rate rate) {
    if (rate.getUnitSize() == null || rate.getUnitSize() <= 0) {
      throw new ValidationException(
          "Invalid unit size", "Rate '" + rate.getName() + "' needs a positive unit size");
    }
  }

  /** Number of started units of {@code unitSize} in {@code value}; partial units count fully. */
  protected static long ceilDiv(long value, long unitSize) {
    long units = value / unitSize;
    return value % unitSize == 0 ? units : units + 1;
  }
}
