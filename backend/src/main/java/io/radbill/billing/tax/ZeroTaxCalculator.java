package io.radbill.billing.tax;

import io.radbill.billing.money.Money;

/** Charges no tax. Used when {@code radbill.tax.mode} is {@code none}. */
public class ZeroTaxCalculator implements TaxCalculator {

  @Override
  public Money calculateTax(Money baseAmount, TaxContext context) {
    return Money.zero(baseAmount.currency());
  }
}
