package io.radbill.billing.strategy;

import io.radbill.billing.money.Money;
import io.radbill.billing.rate.Rate;
import io.radbill.billing.rate.RateType;
import io.radbill.billing.strategy.BillingResult.BreakdownLine;
import io.radbill.billing.usage.UsageData;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Bills connected time against an hourly rate. Every started minute is a billable minute, priced
 * at a sixtieth of the hourly rate.
 */
@Component
public class TimeBillingStrategy extends AbstractBillingStrategy {

  public static final String ID = "time";

  private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);
  private static final int PRICE_SCALE = 10;

  @Override
  public String strategyId() {
    return ID;
  }

  @Override
  public RateType rateType() {
    return RateType.HOURLY;
  }

  @Override
  public BillingResult calculateCharges(UsageData usage, Rate rate) {
    requireValidUsage(usage);
    long billableMinutes = ceilDiv(usage.sessionSeconds(), 60L);

    // multiply before dividing so whole-minute charges stay exact
    Money charge =
        rate.unitPriceMoney().multiply(billableMinutes).divide(MINUTES_PER_HOUR, PRICE_SCALE);
    BigDecimal perMinute = rate.getUnitPrice().divide(MINUTES_PER_HOUR, 6, RoundingMode.HALF_UP);
    BigDecimal minutes = BigDecimal.valueOf(billableMinutes);

    String description =
        "Connected time: "
            + billableMinutes
            + " min @ "
            + rate.getUnitPrice().toPlainString()
            + " "
            + rate.getCurrency()
            + "/h";
    return new BillingResult(
        charge,
        minutes,
        perMinute,
        description,
        List.of(new BreakdownLine("minutes", minutes, perMinute, charge.amount())));
  }
}
