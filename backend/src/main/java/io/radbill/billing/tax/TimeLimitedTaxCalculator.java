package io.radbill.billing.tax;

import io.radbill.billing.exception.BillingException;
import io.radbill.billing.exception.ExternalServiceException;
import io.radbill.billing.money.Money;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounds every call to a delegate calculator by a timeout. Callers compute tax before they mutate
 * anything, so a call that times out leaves the invoice as it was.
 */
public class TimeLimitedTaxCalculator implements TaxCalculator {

  private static final Logger log = LoggerFactory.getLogger(TimeLimitedTaxCalculator.class);

  private final TaxCalculator delegate;
  private final Duration timeout;
  private final Executor executor;

  public TimeLimitedTaxCalculator(TaxCalculator delegate, Duration timeout, Executor executor) {
    this.delegate = delegate;
    this.timeout = timeout;
    this.executor = executor;
  }

  @Override
  public Money calculateTax(Money baseAmount, TaxContext context) {
    CompletableFuture<Money> future =
        CompletableFuture.supplyAsync(() -> delegate.calculateTax(baseAmount, context), executor);
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("Tax calculation timed out after {} for user={}", timeout, context.userId());
      throw new ExternalServiceException(
          "Tax calculation timed out",
          "No tax result for user " + context.userId() + " within " + timeout,
          e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof BillingException billingException) {
        throw billingException;
      }
      throw new ExternalServiceException(
          "Tax calculation failed", "Tax source failed for user " + context.userId(), e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ExternalServiceException(
          "Tax calculation interrupted", "Interrupted waiting for tax of " + context.userId(), e);
    }
  }
}
