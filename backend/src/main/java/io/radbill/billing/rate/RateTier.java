package io.radbill.billing.rate;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * One bracket of a tiered rate.
 *
 * @param usageLimit how many units this bracket covers before usage carries to the next one
 * @param unitPrice the price of one unit inside this bracket
 */
@Embeddable
public record RateTier(
    @Column(name = "usage_limit", nullable = false) long usageLimit,
    @Column(name = "unit_price", nullable = false, precision = 19, scale = 6)
        BigDecimal unitPrice) {

  public RateTier {
    Objects.requireNonNull(unitPrice, "unitPrice must not be null");
  }

  public static RateTier of(long usageLimit, String unitPrice) {
    return new RateTier(usageLimit, new BigDecimal(unitPrice));
  }
}
