package io.radbill.billing.config;

import io.radbill.billing.tax.TaxProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named thread pools: billing-run workers generate invoices for different users in parallel, and
 * the tax pool runs calls to the tax capability so they can be bounded by a timeout.
 */
@Configuration
public class ExecutorConfig {

  public static final String BILLING_RUN_EXECUTOR = "billingRunExecutor";
  public static final String TAX_EXECUTOR = "taxExecutor";

  @Bean(name = BILLING_RUN_EXECUTOR)
  public ThreadPoolTaskExecutor billingRunExecutor(BillingProperties properties) {
    ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
    e.setCorePoolSize(properties.run().threads());
    e.setMaxPoolSize(properties.run().threads());
    e.setThreadNamePrefix("billing-run-");
    e.setWaitForTasksToCompleteOnShutdown(true);
    e.initialize();
    return e;
  }

  @Bean(name = TAX_EXECUTOR)
  public ThreadPoolTaskExecutor taxExecutor(TaxProperties properties) {
    ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
    e.setCorePoolSize(properties.maxConcurrentCalls());
    e.setMaxPoolSize(properties.maxConcurrentCalls());
    e.setThreadNamePrefix("tax-");
    e.initialize();
    return e;
  }
}
