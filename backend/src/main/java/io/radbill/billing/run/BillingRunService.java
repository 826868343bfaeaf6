package io.radbill.billing.run;

import io.radbill.billing.config.BillingProperties;
import io.radbill.billing.config.ExecutorConfig;
import io.radbill.billing.exception.BillingException;
import io.radbill.billing.exception.ResourceConflictException;
import io.radbill.billing.invoice.BillingPeriod;
import io.radbill.billing.invoice.InvoiceService;
import io.radbill.billing.plan.PlanAssignmentRepository;
import io.radbill.billing.run.BillingRunResult.UserOutcome;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Generates the invoices of one billing period for every user with an assigned plan. Users are
 * processed in parallel on the billing-run pool, each in its own transaction, so one user's
 * failure never affects another's invoice. The steps within one invoice always run on a single
 * thread.
 */
@Service
public class BillingRunService {

  private static final Logger log = LoggerFactory.getLogger(BillingRunService.class);

  private final PlanAssignmentRepository planAssignmentRepository;
  private final InvoiceService invoiceService;
  private final Executor executor;
  private final Duration perUserTimeout;
  private final Clock clock;

  public BillingRunService(
      PlanAssignmentRepository planAssignmentRepository,
      InvoiceService invoiceService,
      @Qualifier(ExecutorConfig.BILLING_RUN_EXECUTOR) Executor executor,
      BillingProperties billingProperties,
      Clock clock) {
    this.planAssignmentRepository = planAssignmentRepository;
    this.invoiceService = invoiceService;
    this.executor = executor;
    this.perUserTimeout = billingProperties.run().perUserTimeout();
    this.clock = clock;
  }

  /**
   * Runs a billing cycle. A user who already has an invoice for the period is skipped; a user
   * whose invoice fails or exceeds the per-user timeout is reported as failed. A timed-out
   * invoice may still commit later, since its transaction is not interrupted.
   */
  public BillingRunResult runBillingCycle(BillingPeriod period) {
    Instant started = clock.instant();
    List<String> userIds = planAssignmentRepository.findAllUserIds();
    log.info("Starting billing run for period={} users={}", period, userIds.size());

    Map<String, CompletableFuture<UserOutcome>> futures = new LinkedHashMap<>();
    for (String userId : userIds) {
      futures.put(
          userId,
          CompletableFuture.supplyAsync(
                  () ->
                      UserOutcome.generated(
                          userId, invoiceService.generateInvoice(userId, period).id()),
                  executor)
              .orTimeout(perUserTimeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    List<UserOutcome> outcomes = new ArrayList<>(futures.size());
    futures.forEach((userId, future) -> outcomes.add(awaitOutcome(userId, period, future)));

    var result =
        new BillingRunResult(period, outcomes, Duration.between(started, clock.instant()));
    log.info(
        "Finished billing run for period={} generated={} skipped={} failed={}",
        period,
        result.count(BillingRunResult.Status.GENERATED),
        result.count(BillingRunResult.Status.SKIPPED),
        result.count(BillingRunResult.Status.FAILED));
    return result;
  }

  private UserOutcome awaitOutcome(
      String userId, BillingPeriod period, CompletableFuture<UserOutcome> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof ResourceConflictException conflict) {
        log.debug("Skipping user={} for period={}: {}", userId, period, conflict.getDetail());
        return UserOutcome.skipped(userId, conflict.getDetail());
      }
      if (cause instanceof TimeoutException) {
        log.error(
            "Billing user={} for period={} timed out after {}", userId, period, perUserTimeout);
        return UserOutcome.failed(userId, "Timed out after " + perUserTimeout);
      }
      if (cause instanceof BillingException billingException) {
        log.error(
            "Billing user={} for period={} failed: {}",
            userId,
            period,
            billingException.getMessage());
        return UserOutcome.failed(userId, billingException.getMessage());
      }
      log.error("Billing user={} for period={} failed", userId, period, cause);
      return UserOutcome.failed(userId, cause.toString());
    }
  }
}
