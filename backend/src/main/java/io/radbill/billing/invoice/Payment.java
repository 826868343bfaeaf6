package io.radbill.billing.invoice;

import io.radbill.billing.money.Money;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A payment against an invoice. Status changes go through the owning {@link Invoice} so that the
 * invoice can keep its paid amount and status consistent.
 *
 * <p>A completed payment may be refunded in parts. {@code refundedAmount} is the sum of its
 * refunds; the payment becomes REFUNDED once nothing of it is left.
 */
@Entity
@Table(name = "payments")
public class Payment {

  @Id private UUID id;

  /** Written through the invoice's join column. */
  @Column(name = "invoice_id", insertable = false, updatable = false)
  private UUID invoiceId;

  @Column(name = "payment_number", nullable = false, unique = true, length = 50)
  private String paymentNumber;

  @Column(name = "amount", nullable = false, precision = 19, scale = 4)
  private BigDecimal amount;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "refunded_amount", nullable = false, precision = 19, scale = 4)
  private BigDecimal refundedAmount = BigDecimal.ZERO;

  @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true)
  @JoinColumn(name = "payment_id", nullable = false)
  @OrderBy("refundedAt ASC")
  private List<Refund> refunds = new ArrayList<>();

  @Enumerated(EnumType.STRING)
  @Column(name = "method", nullable = false, length = 20)
  private PaymentMethod method;

  @Column(name = "transaction_ref", length = 255)
  private String transactionRef;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private PaymentStatus status;

  @Column(name = "paid_at", nullable = false)
  private Instant paidAt;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @Column(name = "status_reason", columnDefinition = "TEXT")
  private String statusReason;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version
  @Column(name = "version")
  private Long version;

  protected Payment() {}

  public Payment(
      UUID invoiceId,
      String paymentNumber,
      Money amount,
      PaymentMethod method,
      String transactionRef,
      PaymentStatus status,
      Instant paidAt,
      String notes) {
    this.id = UUID.randomUUID();
    this.invoiceId = invoiceId;
    this.paymentNumber = paymentNumber;
    this.amount = amount.amount();
    this.currency = amount.currency();
    this.method = method;
    this.transactionRef = transactionRef;
    this.status = status;
    this.paidAt = paidAt;
    this.notes = notes;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  void complete() {
    this.status = PaymentStatus.COMPLETED;
    this.updatedAt = Instant.now();
  }

  void fail(String reason) {
    this.status = PaymentStatus.FAILED;
    this.statusReason = reason;
    this.updatedAt = Instant.now();
  }

  Refund addRefund(String refundNumber, Money refundAmount, String reason, Instant refundedAt) {
    var refund = new Refund(id, refundNumber, refundAmount, reason, refundedAt);
    refunds.add(refund);
    this.refundedAmount = refundedAmount.add(refundAmount.amount());
    if (!netAmount().isPositive()) {
      this.status = PaymentStatus.REFUNDED;
      this.statusReason = reason;
    }
    this.updatedAt = Instant.now();
    return refund;
  }

  /** Flags a completed payment of a voided invoice as owed back to the payer. */
  void markRefundDue(String reason) {
    this.statusReason = reason;
    this.updatedAt = Instant.now();
  }

  void cancel(String reason) {
    this.status = PaymentStatus.CANCELLED;
    this.statusReason = reason;
    this.updatedAt = Instant.now();
  }

  public Money amountMoney() {
    return Money.of(amount, currency);
  }

  /** Amount kept after refunds. */
  public Money netAmount() {
    return Money.of(amount.subtract(refundedAmount), currency);
  }

  public UUID getId() {
    return id;
  }

  public UUID getInvoiceId() {
    return invoiceId;
  }

  public String getPaymentNumber() {
    return paymentNumber;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public String getCurrency() {
    return currency;
  }

  public BigDecimal getRefundedAmount() {
    return refundedAmount;
  }

  public List<Refund> getRefunds() {
    return List.copyOf(refunds);
  }

  public PaymentMethod getMethod() {
    return method;
  }

  public String getTransactionRef() {
    return transactionRef;
  }

  public PaymentStatus getStatus() {
    return status;
  }

  public Instant getPaidAt() {
    return paidAt;
  }

  public String getNotes() {
    return notes;
  }

  public String getStatusReason() {
    return statusReason;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
