package io.radbill.billing.usage;

import io.radbill.billing.invoice.BillingPeriod;
import java.util.List;

/**
 * Source of accounting usage, implemented by the RADIUS accounting side of the system. The engine
 * only reads from it; implementations may perform I/O and are called before any invoice is
 * mutated.
 */
public interface UsageDataProvider {

  /**
   * Returns the sessions recorded for {@code userId} that started inside {@code period}. Returns
   * an empty list when the user has no usage.
   */
  List<UsageData> findUsage(String userId, BillingPeriod period);
}
