package io.radbill.billing.money;

import io.radbill.billing.exception.CurrencyMismatchException;
import io.radbill.billing.exception.ValidationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Currency;
import java.util.Locale;
import java.util.Objects;

/**
 * An exact decimal amount tagged with an ISO 4217 currency code. Binary operations require both
 * operands to carry the same currency.
 *
 * <p>Amounts keep full precision through arithmetic; {@link #rounded()} fixes an amount to the
 * currency's minor unit (HALF_UP) and is applied only where a final amount is recorded. Equality is
 * numeric, so {@code 0.6 USD} equals {@code 0.60 USD}. Currency codes are upper-cased.
 */
public record Money(BigDecimal amount, String currency) implements Comparable<Money> {

  private static final int DEFAULT_FRACTION_DIGITS = 2;

  public Money {
    Objects.requireNonNull(amount, "amount must not be null");
    Objects.requireNonNull(currency, "currency must not be null");
    if (currency.length() != 3) {
      throw new ValidationException(
          "Invalid currency", "Currency must be a 3-letter ISO 4217 code, got '" + currency + "'");
    }
    currency = currency.toUpperCase(Locale.ROOT);
  }

  public static Money of(String amount, String currency) {
    return new Money(new BigDecimal(amount), currency);
  }

  public static Money of(BigDecimal amount, String currency) {
    return new Money(amount, currency);
  }

  public static Money zero(String currency) {
    return new Money(BigDecimal.ZERO, currency);
  }

  public Money add(Money other) {
    requireSameCurrency(other);
    return new Money(amount.add(other.amount), currency);
  }

  public Money subtract(Money other) {
    requireSameCurrency(other);
    return new Money(amount.subtract(other.amount), currency);
  }

  public Money multiply(BigDecimal factor) {
    Objects.requireNonNull(factor, "factor must not be null");
    return new Money(amount.multiply(factor), currency);
  }

  public Money multiply(long factor) {
    return multiply(BigDecimal.valueOf(factor));
  }

  /**
   * Divides by a scalar, keeping {@code scale} fractional digits. Used for per-minute prices and
   * blended unit prices; never for recorded amounts.
   */
  public Money divide(BigDecimal divisor, int scale) {
    return new Money(amount.divide(divisor, scale, RoundingMode.HALF_UP), currency);
  }

  /** Rounds HALF_UP to the smallest unit of this currency (two places when unknown). */
  public Money rounded() {
    return new Money(amount.setScale(fractionDigits(), RoundingMode.HALF_UP), currency);
  }

  /** True if the amount has no digits below the smallest unit of this currency. */
  public boolean fitsMinorUnit() {
    return amount.stripTrailingZeros().scale() <= fractionDigits();
  }

  public Money min(Money other) {
    return compareTo(other) <= 0 ? this : other;
  }

  public boolean isZero() {
    return amount.signum() == 0;
  }

  public boolean isPositive() {
    return amount.signum() > 0;
  }

  public boolean isNegative() {
    return amount.signum() < 0;
  }

  public boolean isGreaterThan(Money other) {
    return compareTo(other) > 0;
  }

  public boolean isSameCurrency(Money other) {
    return currency.equals(other.currency);
  }

  @Override
  public int compareTo(Money other) {
    requireSameCurrency(other);
    return amount.compareTo(other.amount);
  }

  int fractionDigits() {
    try {
      int digits = Currency.getInstance(currency).getDefaultFractionDigits();
      return digits >= 0 ? digits : DEFAULT_FRACTION_DIGITS;
    } catch (IllegalArgumentException e) {
      return DEFAULT_FRACTION_DIGITS;
    }
  }

  private void requireSameCurrency(Money other) {
    Objects.requireNonNull(other, "other must not be null");
    if (!currency.equals(other.currency)) {
      throw new CurrencyMismatchException(currency, other.currency);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Money other)) {
      return false;
    }
    return currency.equals(other.currency) && amount.compareTo(other.amount) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(amount.stripTrailingZeros(), currency);
  }

  @Override
  public String toString() {
    return amount.toPlainString() + " " + currency;
  }
}
