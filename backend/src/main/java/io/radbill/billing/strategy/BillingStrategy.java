package io.radbill.billing.strategy;

import io.radbill.billing.rate.Rate;
import io.radbill.billing.rate.RateType;
import io.radbill.billing.usage.UsageData;

/**
 * Converts usage priced by a {@link Rate} into a charge. New billing modes are added by
 * registering another implementation; invoices only ever see the resulting {@link BillingResult}.
 */
public interface BillingStrategy {

  /** Stable identifier stored on billing plans, e.g. {@code "time"}. */
  String strategyId();

  /** The only rate type this strategy can price with. */
  RateType rateType();

  /**
   * Pre-flight check of a rate's configuration, run before the rate is attached to a plan.
   *
   * @throws io.radbill.billing.exception.ValidationException if the rate cannot be used
   */
  void validateBillingParameters(Rate rate);

  /**
   * Prices {@code usage} with {@code rate}. Only the usage shape is checked here; the rate is
   * assumed to have passed {@link #validateBillingParameters(Rate)}.
   *
   * @return the unrounded charge with its breakdown
   */
  BillingResult calculateCharges(UsageData usage, Rate rate);
}
