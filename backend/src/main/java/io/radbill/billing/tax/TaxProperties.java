package io.radbill.billing.tax;

import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the tax capability.
 *
 * @param mode which calculator to use
 * @param ratePercent percentage charged in {@link Mode#PERCENTAGE} mode, e.g. 10.00 for 10%
 * @param timeout upper bound for one tax calculation; zero or absent disables the bound
 * @param maxConcurrentCalls size of the pool that runs bounded tax calls
 */
@ConfigurationProperties(prefix = "radbill.tax")
public record TaxProperties(
    Mode mode, BigDecimal ratePercent, Duration timeout, int maxConcurrentCalls) {

  public TaxProperties {
    if (mode == null) {
      mode = Mode.NONE;
    }
    if (ratePercent == null) {
      ratePercent = BigDecimal.ZERO;
    }
    if (maxConcurrentCalls <= 0) {
      maxConcurrentCalls = 8;
    }
  }

  public boolean isTimeLimited() {
    return timeout != null && !timeout.isZero() && !timeout.isNegative();
  }

  public enum Mode {
    NONE,
    PERCENTAGE
  }
}
