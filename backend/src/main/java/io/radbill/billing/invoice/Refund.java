package io.radbill.billing.invoice;

import io.radbill.billing.money.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** Money returned against a completed payment. Created through {@link Invoice#refundPayment}. */
@Entity
@Table(name = "refunds")
public class Refund {

  @Id private UUID id;

  /** Written through the payment's join column. */
  @Column(name = "payment_id", insertable = false, updatable = false)
  private UUID paymentId;

  @Column(name = "refund_number", nullable = false, unique = true, length = 50)
  private String refundNumber;

  @Column(name = "amount", nullable = false, precision = 19, scale = 4)
  private BigDecimal amount;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "reason", nullable = false, columnDefinition = "TEXT")
  private String reason;

  @Column(name = "refunded_at", nullable = false)
  private Instant refundedAt;

  protected Refund() {}

  Refund(UUID paymentId, String refundNumber, Money amount, String reason, Instant refundedAt) {
    this.id = UUID.randomUUID();
    this.paymentId = paymentId;
    this.refundNumber = refundNumber;
    this.amount = amount.amount();
    this.currency = amount.currency();
    this.reason = reason;
    this.refundedAt = refundedAt;
  }

  public Money amountMoney() {
    return Money.of(amount, currency);
  }

  public UUID getId() {
    return id;
  }

  public UUID getPaymentId() {
    return paymentId;
  }

  public String getRefundNumber() {
    return refundNumber;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public String getCurrency() {
    return currency;
  }

  public String getReason() {
    return reason;
  }

  public Instant getRefundedAt() {
    return refundedAt;
  }
}
