package io.radbill.billing.strategy;

import io.radbill.billing.money.Money;
import io.radbill.billing.rate.Rate;
import io.radbill.billing.rate.RateType;
import io.radbill.billing.strategy.BillingResult.BreakdownLine;
import io.radbill.billing.usage.UsageData;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.stereotype.Component;

/** Bills transferred bytes per started block of the rate's unit size. */
@Component
public class DataVolumeBillingStrategy extends AbstractBillingStrategy {

  public static final String ID = "data_volume";

  @Override
  public String strategyId() {
    return ID;
  }

  @Override
  public RateType rateType() {
    return RateType.PER_UNIT;
  }

  @Override
  protected void validateTypeSpecific(Rate rate) {
    requirePositiveUnitSize(rate);
  }

  @Override
  public BillingResult calculateCharges(UsageData usage, Rate rate) {
    requireValidUsage(usage);
    long billableUnits = ceilDiv(usage.totalBytes(), rate.getUnitSize());
    Money charge = rate.unitPriceMoney().multiply(billableUnits);
    BigDecimal units = BigDecimal.valueOf(billableUnits);

    String description =
        "Data transfer: "
            + billableUnits
            + " x "
            + UnitSizes.describe(rate.getUnitSize())
            + " @ "
            + rate.getUnitPrice().toPlainString()
            + " "
            + rate.getCurrency();
    return new BillingResult(
        charge,
        units,
        rate.getUnitPrice(),
        description,
        List.of(new BreakdownLine("units", units, rate.getUnitPrice(), charge.amount())));
  }
}
