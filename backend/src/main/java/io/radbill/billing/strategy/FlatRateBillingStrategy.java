package io.radbill.billing.strategy;

import io.radbill.billing.rate.Rate;
import io.radbill.billing.rate.RateType;
import io.radbill.billing.strategy.BillingResult.BreakdownLine;
import io.radbill.billing.usage.UsageData;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.stereotype.Component;

/** Charges the rate's fee once per billing period, whatever the usage. */
@Component
public class FlatRateBillingStrategy extends AbstractBillingStrategy {

  public static final String ID = "flat_rate";

  @Override
  public String strategyId() {
    return ID;
  }

  @Override
  public RateType rateType() {
    return RateType.FLAT;
  }

  @Override
  public BillingResult calculateCharges(UsageData usage, Rate rate) {
    requireValidUsage(usage);
    return new BillingResult(
        rate.unitPriceMoney(),
        BigDecimal.ONE,
        rate.getUnitPrice(),
        "Flat fee: " + rate.getName(),
        List.of(
            new BreakdownLine("period", BigDecimal.ONE, rate.getUnitPrice(), rate.getUnitPrice())));
  }
}
