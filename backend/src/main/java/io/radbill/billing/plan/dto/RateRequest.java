package io.radbill.billing.plan.dto;

import io.radbill.billing.rate.Rate;
import io.radbill.billing.rate.RateTier;
import io.radbill.billing.rate.RateType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * A rate to attach to a plan. {@code unitSize} applies to PER_UNIT and TIERED rates, {@code tiers}
 * to TIERED rates only; {@code unitPrice} is ignored for TIERED rates.
 */
public record RateRequest(
    @NotBlank @Size(max = 128) String name,
    @NotNull RateType rateType,
    BigDecimal unitPrice,
    Long unitSize,
    @Valid List<TierRequest> tiers,
    @NotNull @Size(min = 3, max = 3) String currency,
    @NotNull LocalDate effectiveFrom,
    LocalDate effectiveTo) {

  public record TierRequest(@NotNull Long usageLimit, @NotNull BigDecimal unitPrice) {}

  public Rate toRate() {
    return switch (rateType) {
      case HOURLY -> Rate.hourly(name, price(), currency, effectiveFrom, effectiveTo);
      case PER_UNIT -> Rate.perUnit(name, price(), size(), currency, effectiveFrom, effectiveTo);
      case TIERED -> Rate.tiered(name, rateTiers(), size(), currency, effectiveFrom, effectiveTo);
      case FLAT -> Rate.flat(name, price(), currency, effectiveFrom, effectiveTo);
    };
  }

  private BigDecimal price() {
    return unitPrice != null ? unitPrice : BigDecimal.ZERO;
  }

  private long size() {
    return unitSize != null ? unitSize : 0L;
  }

  private List<RateTier> rateTiers() {
    if (tiers == null) {
      return List.of();
    }
    return tiers.stream().map(t -> new RateTier(t.usageLimit(), t.unitPrice())).toList();
  }
}
