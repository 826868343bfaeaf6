package io.radbill.billing.strategy;

import static io.radbill.billing.BillingFixtures.MIB;
import static io.radbill.billing.BillingFixtures.perMibRate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.radbill.billing.exception.ValidationException;
import io.radbill.billing.rate.Rate;
import io.radbill.billing.usage.UsageData;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class DataVolumeBillingStrategyTest {

  private final DataVolumeBillingStrategy strategy = new DataVolumeBillingStrategy();

  @Test
  void partialUnitBillsAsFullUnit() {
    // 1.5 MiB -> 2 started MiB at 0.10
    var usage = UsageData.ofSession("alice", 0, 1_572_864L);

    var result = strategy.calculateCharges(usage, perMibRate("0.10"));

    assertThat(result.quantity()).isEqualByComparingTo("2");
    assertThat(result.baseAmount().amount()).isEqualByComparingTo("0.20");
    assertThat(result.description()).contains("MiB");
  }

  @Test
  void countsBothDirections() {
    var usage = new UsageData("alice", 0, MIB, MIB, 1);

    var result = strategy.calculateCharges(usage, perMibRate("0.10"));

    assertThat(result.quantity()).isEqualByComparingTo("2");
  }

  @Test
  void negativeBytesAreRejected() {
    var usage = new UsageData("alice", 0, -5, 0, 1);

    assertThatThrownBy(() -> strategy.calculateCharges(usage, perMibRate("0.10")))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void validateBillingParameters_requiresPositiveUnitSize() {
    var rate = Rate.perUnit("Broken", new BigDecimal("0.10"), 0, "USD", LocalDate.now(), null);

    assertThatThrownBy(() -> strategy.validateBillingParameters(rate))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("unit size");
  }

  @Test
  void validateBillingParameters_rejectsNegativePrice() {
    var rate = Rate.perUnit("Broken", new BigDecimal("-1"), MIB, "USD", LocalDate.now(), null);

    assertThatThrownBy(() -> strategy.validateBillingParameters(rate))
        .isInstanceOf(ValidationException.class);
  }
}
