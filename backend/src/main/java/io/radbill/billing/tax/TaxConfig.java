package io.radbill.billing.tax;

import io.radbill.billing.config.ExecutorConfig;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Selects the tax calculator from {@code radbill.tax.mode}. */
@Configuration
public class TaxConfig {

  private static final Logger log = LoggerFactory.getLogger(TaxConfig.class);

  @Bean
  public TaxCalculator taxCalculator(
      TaxProperties properties, @Qualifier(ExecutorConfig.TAX_EXECUTOR) Executor taxExecutor) {
    TaxCalculator calculator =
        switch (properties.mode()) {
          case NONE -> new ZeroTaxCalculator();
          case PERCENTAGE -> new PercentageTaxCalculator(properties.ratePercent());
        };
    log.info(
        "Tax calculator configured: mode={}, ratePercent={}, timeout={}",
        properties.mode(),
        properties.ratePercent(),
        properties.timeout());
    if (properties.isTimeLimited()) {
      return new TimeLimitedTaxCalculator(calculator, properties.timeout(), taxExecutor);
    }
    return calculator;
  }
}
