package io.radbill.billing.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for invoice generation.
 *
 * @param defaultCurrency currency of invoices for users whose plan has no rates yet
 * @param paymentTermsDays days between issue date and due date when an invoice is sent
 * @param run settings of the parallel billing run
 */
@ConfigurationProperties(prefix = "radbill.billing")
public record BillingProperties(String defaultCurrency, int paymentTermsDays, Run run) {

  public BillingProperties {
    if (defaultCurrency == null || defaultCurrency.isBlank()) {
      defaultCurrency = "USD";
    }
    if (paymentTermsDays <= 0) {
      paymentTermsDays = 30;
    }
    if (run == null) {
      run = new Run(0, null);
    }
  }

  /**
   * @param threads worker threads generating invoices in parallel
   * @param perUserTimeout how long a single user's invoice may take before it is reported failed
   */
  public record Run(int threads, Duration perUserTimeout) {

    public Run {
      if (threads <= 0) {
        threads = 4;
      }
      if (perUserTimeout == null) {
        perUserTimeout = Duration.ofSeconds(30);
      }
    }
  }
}
