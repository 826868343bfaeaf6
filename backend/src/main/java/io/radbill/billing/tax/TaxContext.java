package io.radbill.billing.tax;

import io.radbill.billing.invoice.BillingPeriod;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Facts a tax calculator may base its decision on.
 *
 * @param userId the billed user
 * @param period the billing period of the invoice
 * @param taxPointDate the date tax is assessed on
 */
public record TaxContext(String userId, BillingPeriod period, LocalDate taxPointDate) {

  public TaxContext {
    Objects.requireNonNull(userId, "userId must not be null");
    Objects.requireNonNull(taxPointDate, "taxPointDate must not be null");
  }
}
