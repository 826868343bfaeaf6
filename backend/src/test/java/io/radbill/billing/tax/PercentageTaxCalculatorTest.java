package io.radbill.billing.tax;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.radbill.billing.exception.ValidationException;
import io.radbill.billing.money.Money;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class PercentageTaxCalculatorTest {

  private final TaxContext context = new TaxContext("alice", null, LocalDate.of(2024, 2, 1));

  @Test
  void calculateTax_appliesRateToBase() {
    var calculator = new PercentageTaxCalculator(new BigDecimal("10"));

    assertThat(calculator.calculateTax(Money.of("15.00", "USD"), context))
        .isEqualTo(Money.of("1.50", "USD"));
  }

  @Test
  void calculateTax_roundsHalfUpToCents() {
    var calculator = new PercentageTaxCalculator(new BigDecimal("7.5"));

    // 0.33 * 7.5% = 0.02475
    assertThat(calculator.calculateTax(Money.of("0.33", "EUR"), context).amount())
        .isEqualByComparingTo("0.02");
    // 0.34 * 7.5% = 0.0255
    assertThat(calculator.calculateTax(Money.of("0.34", "EUR"), context).amount())
        .isEqualByComparingTo("0.03");
  }

  @Test
  void calculateTax_roundsToWholeYen() {
    var calculator = new PercentageTaxCalculator(new BigDecimal("10"));

    // 1005 * 10% = 100.5
    var tax = calculator.calculateTax(Money.of("1005", "JPY"), context);

    assertThat(tax.amount()).isEqualByComparingTo("101");
    assertThat(tax.amount().scale()).isZero();
  }

  @Test
  void calculateTax_keepsCurrency() {
    var calculator = new PercentageTaxCalculator(new BigDecimal("20"));

    assertThat(calculator.calculateTax(Money.of("10", "GBP"), context).currency()).isEqualTo("GBP");
  }

  @Test
  void zeroRate_yieldsZeroTax() {
    var calculator = new PercentageTaxCalculator(BigDecimal.ZERO);

    assertThat(calculator.calculateTax(Money.of("99.99", "USD"), context).isZero()).isTrue();
  }

  @Test
  void negativeRate_isRejected() {
    assertThatThrownBy(() -> new PercentageTaxCalculator(new BigDecimal("-1")))
        .isInstanceOf(ValidationException.class);
  }
}
