package io.radbill.billing.run;

import io.radbill.billing.invoice.BillingPeriod;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of generating invoices for every assigned user in one period.
 *
 * @param outcomes one entry per user, in user id order
 */
public record BillingRunResult(BillingPeriod period, List<UserOutcome> outcomes, Duration elapsed) {

  public BillingRunResult {
    outcomes = List.copyOf(outcomes);
  }

  public long count(Status status) {
    return outcomes.stream().filter(o -> o.status() == status).count();
  }

  public List<UserOutcome> failures() {
    return outcomes.stream().filter(o -> o.status() == Status.FAILED).toList();
  }

  public enum Status {
    GENERATED,
    /** An invoice for the period already existed. */
    SKIPPED,
    FAILED
  }

  /**
   * @param invoiceId the generated invoice, null unless GENERATED
   * @param error failure description, null when GENERATED
   */
  public record UserOutcome(String userId, Status status, UUID invoiceId, String error) {

    static UserOutcome generated(String userId, UUID invoiceId) {
      return new UserOutcome(userId, Status.GENERATED, invoiceId, null);
    }

    static UserOutcome skipped(String userId, String reason) {
      return new UserOutcome(userId, Status.SKIPPED, null, reason);
    }

    static UserOutcome failed(String userId, String error) {
      return new UserOutcome(userId, Status.FAILED, null, error);
    }
  }
}
