package io.radbill.billing.tax;

import io.radbill.billing.exception.ValidationException;
import io.radbill.billing.money.Money;
import java.math.BigDecimal;

/**
 * Adds a fixed percentage on top of the base amount, rounded HALF_UP to the minor unit of the base
 * amount's currency.
 */
public class PercentageTaxCalculator implements TaxCalculator {

  private static final BigDecimal HUNDRED = new BigDecimal("100");

  private final BigDecimal ratePercent;

  public PercentageTaxCalculator(BigDecimal ratePercent) {
    if (ratePercent == null || ratePercent.signum() < 0) {
      throw new ValidationException(
          "Invalid tax rate", "Tax rate must be zero or positive, got " + ratePercent);
    }
    this.ratePercent = ratePercent;
  }

  @Override
  public Money calculateTax(Money baseAmount, TaxContext context) {
    BigDecimal tax = baseAmount.amount().multiply(ratePercent).divide(HUNDRED);
    return Money.of(tax, baseAmount.currency()).rounded();
  }

  public BigDecimal getRatePercent() {
    return ratePercent;
  }
}
