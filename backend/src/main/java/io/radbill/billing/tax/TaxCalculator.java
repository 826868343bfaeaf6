package io.radbill.billing.tax;

import io.radbill.billing.money.Money;

/**
 * Computes the tax owed on a base amount. Implementations are interchangeable; jurisdiction rules
 * live behind this interface and are opaque to invoices.
 */
public interface TaxCalculator {

  /**
   * Returns the tax on {@code baseAmount}, in the same currency.
   *
   * @throws io.radbill.billing.exception.ExternalServiceException if the tax source fails
   */
  Money calculateTax(Money baseAmount, TaxContext context);
}
