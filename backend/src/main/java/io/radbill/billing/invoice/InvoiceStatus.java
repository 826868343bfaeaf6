package io.radbill.billing.invoice;

/**
 * Invoice lifecycle status. Enforces valid state transitions.
 *
 * <p>Valid transitions:
 *
 * <ul>
 *   <li>DRAFT → SENT (items frozen, number assigned)
 *   <li>SENT → PARTIALLY_PAID or PAID (payment recorded)
 *   <li>PARTIALLY_PAID → PAID (balance settled)
 *   <li>PAID → PARTIALLY_PAID (a completed payment was refunded)
 *   <li>DRAFT, SENT, PARTIALLY_PAID → VOID
 *   <li>VOID is terminal
 * </ul>
 */
public enum InvoiceStatus {
  DRAFT,
  SENT,
  PARTIALLY_PAID,
  PAID,
  VOID;

  public boolean canTransitionTo(InvoiceStatus target) {
    return switch (this) {
      case DRAFT -> target == SENT || target == VOID;
      case SENT -> target == PARTIALLY_PAID || target == PAID || target == VOID;
      case PARTIALLY_PAID -> target == PARTIALLY_PAID || target == PAID || target == VOID;
      case PAID -> target == PARTIALLY_PAID;
      case VOID -> false;
    };
  }

  /** Payments may be recorded only in these states. */
  public boolean acceptsPayments() {
    return this == SENT || this == PARTIALLY_PAID;
  }
}
