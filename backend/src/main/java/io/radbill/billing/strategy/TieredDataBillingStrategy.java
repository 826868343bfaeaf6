package io.radbill.billing.strategy;

import io.radbill.billing.exception.ValidationException;
import io.radbill.billing.money.Money;
import io.radbill.billing.rate.Rate;
import io.radbill.billing.rate.RateTier;
import io.radbill.billing.rate.RateType;
import io.radbill.billing.strategy.BillingResult.BreakdownLine;
import io.radbill.billing.usage.UsageData;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Bills transferred data through consecutive brackets. Usage, in started units of the rate's unit
 * size, fills the tiers in ascending {@code usageLimit} order; each tier bills
 * {@code min(remaining, usageLimit) x unitPrice} and passes the rest on. Whatever is left after
 * the last tier is billed at the last tier's price.
 */
@Component
public class TieredDataBillingStrategy extends AbstractBillingStrategy {

  public static final String ID = "tiered_data";

  @Override
  public String strategyId() {
    return ID;
  }

  @Override
  public RateType rateType() {
    return RateType.TIERED;
  }

  @Override
  protected void validateTypeSpecific(Rate rate) {
    requirePositiveUnitSize(rate);
    if (rate.getTiers().isEmpty()) {
      throw new ValidationException(
          "Missing tiers", "Tiered rate '" + rate.getName() + "' defines no tiers");
    }
    for (RateTier tier : rate.getTiers()) {
      if (tier.usageLimit() <= 0) {
        throw new ValidationException(
            "Invalid tier", "Tier limits of rate '" + rate.getName() + "' must be positive");
      }
      if (tier.unitPrice().signum() < 0) {
        throw new ValidationException(
            "Invalid tier", "Tier prices of rate '" + rate.getName() + "' must not be negative");
      }
    }
  }

  @Override
  public BillingResult calculateCharges(UsageData usage, Rate rate) {
    requireValidUsage(usage);
    long totalUnits = ceilDiv(usage.totalBytes(), rate.getUnitSize());
    List<RateTier> tiers = rate.sortedTiers();

    Money charge = Money.zero(rate.getCurrency());
    List<BreakdownLine> breakdown = new ArrayList<>();
    long remaining = totalUnits;
    int index = 1;
    for (RateTier tier : tiers) {
      if (remaining <= 0) {
        break;
      }
      long inTier = Math.min(remaining, tier.usageLimit());
      Money tierCharge = Money.of(tier.unitPrice(), rate.getCurrency()).multiply(inTier);
      charge = charge.add(tierCharge);
      breakdown.add(
          new BreakdownLine(
              "tier " + index, BigDecimal.valueOf(inTier), tier.unitPrice(), tierCharge.amount()));
      remaining -= inTier;
      index++;
    }
    if (remaining > 0) {
      RateTier last = tiers.get(tiers.size() - 1);
      Money excessCharge = Money.of(last.unitPrice(), rate.getCurrency()).multiply(remaining);
      charge = charge.add(excessCharge);
      breakdown.add(
          new BreakdownLine(
              "beyond last tier",
              BigDecimal.valueOf(remaining),
              last.unitPrice(),
              excessCharge.amount()));
    }

    BigDecimal quantity = BigDecimal.valueOf(totalUnits);
    BigDecimal blendedPrice =
        totalUnits == 0
            ? tiers.get(0).unitPrice()
            : charge.amount().divide(quantity, 6, RoundingMode.HALF_UP);
    String description =
        "Tiered data transfer: "
            + totalUnits
            + " x "
            + UnitSizes.describe(rate.getUnitSize())
            + " across "
            + breakdown.size()
            + " tier(s)";
    return new BillingResult(charge, quantity, blendedPrice, description, breakdown);
  }
}
