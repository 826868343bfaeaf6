package io.radbill.billing.plan;

import static io.radbill.billing.BillingFixtures.JAN_1;
import static io.radbill.billing.BillingFixtures.TODAY;
import static io.radbill.billing.BillingFixtures.flatRate;
import static io.radbill.billing.BillingFixtures.hourlyRate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.radbill.billing.event.BillingPlanActivatedEvent;
import io.radbill.billing.event.BillingPlanDeactivatedEvent;
import io.radbill.billing.event.RateAddedEvent;
import io.radbill.billing.exception.CurrencyMismatchException;
import io.radbill.billing.exception.InactivePlanException;
import io.radbill.billing.exception.MissingRateException;
import io.radbill.billing.exception.NoApplicableRateException;
import io.radbill.billing.exception.RateConflictException;
import io.radbill.billing.rate.Rate;
import io.radbill.billing.strategy.BillingStrategyRegistry;
import io.radbill.billing.strategy.TimeBillingStrategy;
import io.radbill.billing.usage.UsageData;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class BillingPlanTest {

  private final BillingStrategyRegistry registry = BillingStrategyRegistry.defaults();
  private final UsageData oneHour = UsageData.ofSession("alice", 3600, 0);

  @Test
  void addRate_recordsEvent() {
    var plan = new BillingPlan("Hourly", null, TimeBillingStrategy.ID);

    plan.addRate(hourlyRate("12.00"));

    assertThat(plan.getRates()).hasSize(1);
    assertThat(plan.currency()).contains("USD");
    assertThat(plan.domainEvents()).singleElement().isInstanceOf(RateAddedEvent.class);
  }

  @Test
  void addRate_overlappingSameType_isRejectedAndPlanUnchanged() {
    var plan = new BillingPlan("Hourly", null, TimeBillingStrategy.ID);
    plan.addRate(hourlyRate("12.00"));
    var overlapping =
        Rate.hourly("Summer", new BigDecimal("9.00"), "USD", LocalDate.of(2024, 6, 1), null);

    assertThatThrownBy(() -> plan.addRate(overlapping)).isInstanceOf(RateConflictException.class);
    assertThat(plan.getRates()).hasSize(1);
  }

  @Test
  void addRate_windowsTouchingOnInclusiveEnd_conflict() {
    var plan = new BillingPlan("Hourly", null, TimeBillingStrategy.ID);
    plan.addRate(Rate.hourly("Jan", BigDecimal.TEN, "USD", JAN_1, LocalDate.of(2024, 1, 31)));

    var sameDay = Rate.hourly("Late Jan", BigDecimal.ONE, "USD", LocalDate.of(2024, 1, 31), null);

    assertThatThrownBy(() -> plan.addRate(sameDay)).isInstanceOf(RateConflictException.class);
  }

  @Test
  void calculateCharges_selectsRateEffectiveOnDate() {
    var plan = new BillingPlan("Hourly", null, TimeBillingStrategy.ID);
    plan.addRate(
        Rate.hourly("Jan", new BigDecimal("6.00"), "USD", JAN_1, LocalDate.of(2024, 1, 31)));
    plan.addRate(
        Rate.hourly("Feb", new BigDecimal("12.00"), "USD", LocalDate.of(2024, 2, 1), null));

    var january = plan.calculateCharges(oneHour, registry, LocalDate.of(2024, 1, 31));
    var february = plan.calculateCharges(oneHour, registry, LocalDate.of(2024, 2, 1));

    assertThat(january.result().baseAmount().amount()).isEqualByComparingTo("6.00");
    assertThat(january.rate().getName()).isEqualTo("Jan");
    assertThat(february.result().baseAmount().amount()).isEqualByComparingTo("12.00");
    assertThat(february.strategyId()).isEqualTo(TimeBillingStrategy.ID);
  }

  @Test
  void ratesOfDifferentTypesMayOverlap() {
    var plan = new BillingPlan("Mixed", null, TimeBillingStrategy.ID);
    plan.addRate(hourlyRate("12.00"));
    plan.addRate(flatRate("5.00"));

    assertThat(plan.getRates()).hasSize(2);
  }

  @Test
  void addRate_otherCurrency_throws() {
    var plan = new BillingPlan("Hourly", null, TimeBillingStrategy.ID);
    plan.addRate(hourlyRate("12.00"));
    var euroRate = Rate.flat("Fee", BigDecimal.ONE, "EUR", JAN_1, null);

    assertThatThrownBy(() -> plan.addRate(euroRate)).isInstanceOf(CurrencyMismatchException.class);
  }

  @Test
  void calculateCharges_inactivePlan_throws() {
    var plan = new BillingPlan("Hourly", null, TimeBillingStrategy.ID);
    plan.addRate(hourlyRate("12.00"));
    plan.deactivate();

    assertThatThrownBy(() -> plan.calculateCharges(oneHour, registry, TODAY))
        .isInstanceOf(InactivePlanException.class);
  }

  @Test
  void calculateCharges_noRateOfStrategyType_throwsMissingRate() {
    var plan = new BillingPlan("Hourly", null, TimeBillingStrategy.ID);
    plan.addRate(flatRate("5.00"));

    assertThatThrownBy(() -> plan.calculateCharges(oneHour, registry, TODAY))
        .isInstanceOf(MissingRateException.class);
  }

  @Test
  void calculateCharges_noRateInForce_throwsNoApplicableRate() {
    var plan = new BillingPlan("Hourly", null, TimeBillingStrategy.ID);
    plan.addRate(hourlyRate("12.00"));

    assertThatThrownBy(() -> plan.calculateCharges(oneHour, registry, LocalDate.of(2023, 12, 31)))
        .isInstanceOf(NoApplicableRateException.class);
  }

  @Test
  void activateAndDeactivate_areIdempotent_andEmitOnlyOnChange() {
    var plan = new BillingPlan("Hourly", null, TimeBillingStrategy.ID);

    plan.activate();
    plan.deactivate();
    plan.deactivate();
    plan.activate();

    assertThat(plan.isActive()).isTrue();
    assertThat(plan.domainEvents())
        .hasExactlyElementsOfTypes(
            BillingPlanDeactivatedEvent.class, BillingPlanActivatedEvent.class);
  }

  @Test
  void clearDomainEvents_drainsPendingEvents() {
    var plan = new BillingPlan("Hourly", null, TimeBillingStrategy.ID);
    plan.deactivate();

    plan.clearDomainEvents();

    assertThat(plan.domainEvents()).isEmpty();
  }
}
