package io.radbill.billing.invoice;

import io.radbill.billing.event.BillingDomainEvent;
import io.radbill.billing.event.InvoiceCreatedEvent;
import io.radbill.billing.event.InvoiceDiscountAppliedEvent;
import io.radbill.billing.event.InvoiceItemAddedEvent;
import io.radbill.billing.event.InvoiceSentEvent;
import io.radbill.billing.event.InvoiceTaxAppliedEvent;
import io.radbill.billing.event.InvoiceVoidedEvent;
import io.radbill.billing.event.PaymentCompletedEvent;
import io.radbill.billing.event.PaymentFailedEvent;
import io.radbill.billing.event.PaymentRecordedEvent;
import io.radbill.billing.event.PaymentRefundedEvent;
import io.radbill.billing.exception.CurrencyMismatchException;
import io.radbill.billing.exception.EmptyInvoiceException;
import io.radbill.billing.exception.InvalidStateException;
import io.radbill.billing.exception.InvoiceNotEditableException;
import io.radbill.billing.exception.OverpaymentException;
import io.radbill.billing.exception.ResourceNotFoundException;
import io.radbill.billing.exception.ValidationException;
import io.radbill.billing.money.Money;
import io.radbill.billing.plan.BillingPlan;
import io.radbill.billing.plan.PlanCharge;
import io.radbill.billing.strategy.BillingStrategyRegistry;
import io.radbill.billing.tax.TaxCalculator;
import io.radbill.billing.tax.TaxContext;
import io.radbill.billing.usage.UsageData;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.AfterDomainEventPublication;
import org.springframework.data.domain.DomainEvents;

/**
 * Invoice for one user and billing period. Owns its items and payments and keeps them consistent
 * with its totals: {@code totalAmount} always equals the sum of item amounts minus {@code
 * discountAmount} plus {@code taxAmount}, and completed payments never exceed {@code totalAmount}.
 *
 * <p>Lifecycle: DRAFT (items may be added, tax applied) → SENT (numbered, items frozen) →
 * PARTIALLY_PAID / PAID as payments arrive. Any state except PAID can be voided. See {@link
 * InvoiceStatus} for the full transition table.
 *
 * <p>Every operation validates before it mutates, so a failed call leaves the invoice unchanged.
 * Successful mutations record a {@link BillingDomainEvent}, published when the invoice is saved.
 */
@Entity
@Table(name = "invoices")
public class Invoice {

  @Id private UUID id;

  @Column(name = "invoice_number", unique = true, length = 50)
  private String invoiceNumber;

  @Column(name = "user_id", nullable = false, length = 128)
  private String userId;

  @Embedded private BillingPeriod period;

  @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true)
  @JoinColumn(name = "invoice_id", nullable = false)
  @OrderBy("sortOrder ASC")
  private List<InvoiceItem> items = new ArrayList<>();

  @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true)
  @JoinColumn(name = "invoice_id", nullable = false)
  @OrderBy("createdAt ASC")
  private List<Payment> payments = new ArrayList<>();

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private InvoiceStatus status = InvoiceStatus.DRAFT;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "subtotal", nullable = false, precision = 19, scale = 4)
  private BigDecimal subtotal = BigDecimal.ZERO;

  @Column(name = "discount_amount", nullable = false, precision = 19, scale = 4)
  private BigDecimal discountAmount = BigDecimal.ZERO;

  @Column(name = "tax_amount", nullable = false, precision = 19, scale = 4)
  private BigDecimal taxAmount = BigDecimal.ZERO;

  @Column(name = "total_amount", nullable = false, precision = 19, scale = 4)
  private BigDecimal totalAmount = BigDecimal.ZERO;

  @Column(name = "issue_date")
  private LocalDate issueDate;

  @Column(name = "due_date")
  private LocalDate dueDate;

  @Column(name = "void_reason", columnDefinition = "TEXT")
  private String voidReason;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version
  @Column(name = "version")
  private Long version;

  @Transient private final List<BillingDomainEvent> domainEvents = new ArrayList<>();

  protected Invoice() {}

  public Invoice(String userId, BillingPeriod period, String currency) {
    if (userId == null || userId.isBlank()) {
      throw new ValidationException("Invalid user", "Invoice user id must not be blank");
    }
    if (period == null) {
      throw new ValidationException("Invalid billing period", "Billing period must not be null");
    }
    this.id = UUID.randomUUID();
    this.userId = userId;
    this.period = period;
    this.currency = Money.zero(currency).currency();
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
    domainEvents.add(
        new InvoiceCreatedEvent(
            id, userId, period.start(), period.end(), this.currency, Instant.now()));
  }

  /**
   * Prices {@code usage} with {@code plan} as of {@code asOf} and appends the result as a new item.
   * The invoice's tax amount is kept as it was; call {@link #applyTax} again to refresh it.
   *
   * @throws InvoiceNotEditableException if the invoice is not a draft
   * @throws CurrencyMismatchException if the charge is not in the invoice currency
   */
  public InvoiceItem addBillingItem(
      UsageData usage, BillingPlan plan, BillingStrategyRegistry registry, LocalDate asOf) {
    requireDraft();
    PlanCharge charge = plan.calculateCharges(usage, registry, asOf);
    String chargeCurrency = charge.result().baseAmount().currency();
    if (!currency.equals(chargeCurrency)) {
      throw new CurrencyMismatchException(currency, chargeCurrency);
    }
    InvoiceItem item = InvoiceItem.fromCharge(usage, charge, items.size());
    items.add(item);
    recalculateTotals();
    domainEvents.add(
        new InvoiceItemAddedEvent(
            id,
            item.getDescription(),
            charge.strategyId(),
            item.getAmount(),
            totalAmount,
            Instant.now()));
    return item;
  }

  /**
   * Grants a discount off the subtotal. The tax amount is kept as it was; call {@link #applyTax}
   * again to tax the discounted subtotal.
   *
   * @throws InvoiceNotEditableException if the invoice is not a draft
   * @throws ValidationException if the discount is negative, finer than the currency's minor unit
   *     or larger than the subtotal
   * @throws CurrencyMismatchException if the discount is not in the invoice currency
   */
  public void applyDiscount(Money discount) {
    requireDraft();
    requireInvoiceCurrency(discount);
    if (discount.isNegative() || !discount.fitsMinorUnit()) {
      throw new ValidationException(
          "Invalid discount",
          "Discount must be zero or positive in whole "
              + currency
              + " minor units, got "
              + discount.amount());
    }
    if (discount.isGreaterThan(subtotal())) {
      throw new ValidationException(
          "Invalid discount",
          "Discount " + discount + " exceeds the subtotal " + subtotal() + " of invoice " + id);
    }
    this.discountAmount = discount.amount();
    recalculateTotals();
    domainEvents.add(
        new InvoiceDiscountAppliedEvent(id, discountAmount, totalAmount, Instant.now()));
  }

  /**
   * Recomputes the invoice tax from the discounted subtotal, and each item's informational tax from
   * its own amount. Applying tax twice with unchanged items and context gives the same result.
   *
   * @throws InvoiceNotEditableException if the invoice is not a draft
   */
  public void applyTax(TaxCalculator taxCalculator, TaxContext context) {
    requireDraft();
    // all calculator calls complete before anything is assigned
    Money invoiceTax =
        requireInvoiceCurrency(
            taxCalculator.calculateTax(subtotal().subtract(discountMoney()), context));
    List<Money> itemTaxes = new ArrayList<>(items.size());
    for (InvoiceItem item : items) {
      itemTaxes.add(
          requireInvoiceCurrency(taxCalculator.calculateTax(item.amountMoney(), context)));
    }
    for (int i = 0; i < items.size(); i++) {
      items.get(i).setTaxAmount(itemTaxes.get(i));
    }
    this.taxAmount = invoiceTax.amount();
    recalculateTotals();
    domainEvents.add(new InvoiceTaxAppliedEvent(id, taxAmount, totalAmount, Instant.now()));
  }

  /**
   * Sends the invoice: assigns its number and dates and freezes its items. An invoice whose total
   * is zero has nothing to collect and is settled straight away.
   *
   * @throws EmptyInvoiceException if the invoice has no items
   * @throws InvalidStateException if the invoice is not a draft
   */
  public void markAsSent(String invoiceNumber, LocalDate issueDate, LocalDate dueDate) {
    if (!status.canTransitionTo(InvoiceStatus.SENT)) {
      throw new InvalidStateException(
          "Invalid invoice status",
          "Cannot send invoice in status " + status + ". Must be DRAFT.");
    }
    if (items.isEmpty()) {
      throw new EmptyInvoiceException(id);
    }
    if (invoiceNumber == null || invoiceNumber.isBlank()) {
      throw new ValidationException("Invalid invoice number", "Invoice number must not be blank");
    }
    if (issueDate == null || dueDate == null || dueDate.isBefore(issueDate)) {
      throw new ValidationException(
          "Invalid invoice dates",
          "Due date " + dueDate + " must not be before issue date " + issueDate);
    }
    this.invoiceNumber = invoiceNumber;
    this.issueDate = issueDate;
    this.dueDate = dueDate;
    this.status = InvoiceStatus.SENT;
    if (totalAmount.signum() == 0) {
      this.status = InvoiceStatus.PAID;
    }
    this.updatedAt = Instant.now();
    domainEvents.add(
        new InvoiceSentEvent(
            id, userId, invoiceNumber, totalAmount, currency, dueDate, Instant.now()));
  }

  /**
   * Records a pending or completed payment.
   *
   * @throws InvalidStateException if the invoice is not awaiting payment
   * @throws ValidationException if the amount is not positive, is finer than the currency's minor
   *     unit, or the payment status is not PENDING or COMPLETED
   * @throws CurrencyMismatchException if the payment is not in the invoice currency
   * @throws OverpaymentException if pending and completed payments would exceed the total
   */
  public void recordPayment(Payment payment) {
    if (!status.acceptsPayments()) {
      throw new InvalidStateException(
          "Invalid invoice status",
          "Cannot record payment for invoice in status "
              + status
              + ". Must be SENT or PARTIALLY_PAID.");
    }
    if (!id.equals(payment.getInvoiceId())) {
      throw new ValidationException(
          "Invalid payment", "Payment belongs to invoice " + payment.getInvoiceId());
    }
    if (payment.getAmount() == null || payment.getAmount().signum() <= 0) {
      throw new ValidationException(
          "Invalid payment amount", "Payment amount must be positive, got " + payment.getAmount());
    }
    if (!payment.amountMoney().fitsMinorUnit()) {
      throw new ValidationException(
          "Invalid payment amount",
          "Payment amount "
              + payment.getAmount()
              + " has more decimal places than "
              + payment.getCurrency()
              + " allows");
    }
    if (!payment.getStatus().isCommitted()) {
      throw new ValidationException(
          "Invalid payment status",
          "Only PENDING or COMPLETED payments can be recorded, got " + payment.getStatus());
    }
    if (!currency.equals(payment.getCurrency())) {
      throw new CurrencyMismatchException(currency, payment.getCurrency());
    }
    Money remaining = totalMoney().subtract(committedPayments());
    if (payment.amountMoney().isGreaterThan(remaining)) {
      throw new OverpaymentException(id, payment.getAmount(), remaining.amount());
    }
    payments.add(payment);
    settleStatus();
    domainEvents.add(
        new PaymentRecordedEvent(
            id,
            payment.getId(),
            payment.getAmount(),
            payment.getCurrency(),
            payment.getStatus().name(),
            status.name(),
            Instant.now()));
  }

  /** Confirms a pending payment. */
  public void completePayment(UUID paymentId) {
    Payment payment = requirePayment(paymentId, PaymentStatus.PENDING);
    payment.complete();
    settleStatus();
    domainEvents.add(
        new PaymentCompletedEvent(
            id, paymentId, payment.getAmount(), status.name(), Instant.now()));
  }

  /** Marks a pending payment as failed; it no longer counts against the total. */
  public void failPayment(UUID paymentId, String reason) {
    Payment payment = requirePayment(paymentId, PaymentStatus.PENDING);
    payment.fail(reason);
    this.updatedAt = Instant.now();
    domainEvents.add(new PaymentFailedEvent(id, paymentId, reason, Instant.now()));
  }

  /**
   * Returns {@code amount} of a completed payment to the payer. The payment stays COMPLETED until
   * all of it has been refunded. A PAID invoice falls back to PARTIALLY_PAID; a void invoice stays
   * void and its refund due shrinks.
   *
   * @throws InvalidStateException if the payment is not COMPLETED
   * @throws ValidationException if the reason is blank, or the amount is not positive, is finer
   *     than the currency's minor unit or exceeds what is left of the payment
   * @throws CurrencyMismatchException if the refund is not in the invoice currency
   */
  public Refund refundPayment(UUID paymentId, Money amount, String refundNumber, String reason) {
    if (reason == null || reason.isBlank()) {
      throw new ValidationException("Invalid refund", "Refund reason must not be blank");
    }
    if (refundNumber == null || refundNumber.isBlank()) {
      throw new ValidationException("Invalid refund", "Refund number must not be blank");
    }
    Payment payment = requirePayment(paymentId, PaymentStatus.COMPLETED);
    requireInvoiceCurrency(amount);
    if (!amount.isPositive() || !amount.fitsMinorUnit()) {
      throw new ValidationException(
          "Invalid refund amount",
          "Refund amount must be positive in whole "
              + currency
              + " minor units, got "
              + amount.amount());
    }
    if (amount.isGreaterThan(payment.netAmount())) {
      throw new ValidationException(
          "Refund exceeds payment",
          "Refund of "
              + amount
              + " exceeds the "
              + payment.netAmount()
              + " left of payment "
              + paymentId);
    }
    Refund refund = payment.addRefund(refundNumber, amount, reason, Instant.now());
    settleStatus();
    domainEvents.add(
        new PaymentRefundedEvent(
            id,
            paymentId,
            refund.getRefundNumber(),
            refund.getAmount(),
            payment.netAmount().amount(),
            reason,
            status.name(),
            Instant.now()));
    return refund;
  }

  /** What is left to refund of a completed payment. */
  public Money refundableAmount(UUID paymentId) {
    return requirePayment(paymentId, PaymentStatus.COMPLETED).netAmount();
  }

  /** Outstanding amount: total minus completed payments. */
  public Money getBalanceDue() {
    return totalMoney().subtract(completedPayments());
  }

  /** Money received on a void invoice that has not been refunded yet; zero otherwise. */
  public Money getRefundDue() {
    return status == InvoiceStatus.VOID ? completedPayments() : Money.zero(currency);
  }

  /**
   * Voids the invoice and cancels its pending payments. Completed payments are kept and flagged as
   * due for refund; the amount received is reported in the voided event and by {@link
   * #getRefundDue()}.
   *
   * @throws InvalidStateException if the invoice is PAID or already VOID
   */
  public void voidInvoice(String reason) {
    if (!status.canTransitionTo(InvoiceStatus.VOID)) {
      throw new InvalidStateException(
          "Invalid invoice status",
          "Cannot void invoice in status " + status + ". Must not be PAID or already VOID.");
    }
    if (reason == null || reason.isBlank()) {
      throw new ValidationException("Invalid void reason", "Void reason must not be blank");
    }
    InvoiceStatus previous = status;
    for (Payment payment : payments) {
      if (payment.getStatus() == PaymentStatus.PENDING) {
        payment.cancel("Invoice voided");
      } else if (payment.getStatus() == PaymentStatus.COMPLETED) {
        payment.markRefundDue("Refund due: invoice voided");
      }
    }
    this.status = InvoiceStatus.VOID;
    this.voidReason = reason;
    this.updatedAt = Instant.now();
    domainEvents.add(
        new InvoiceVoidedEvent(
            id, previous.name(), reason, getRefundDue().amount(), currency, Instant.now()));
  }

  /** True if the invoice is awaiting payment and its due date is before {@code today}. */
  public boolean isOverdue(LocalDate today) {
    return status.acceptsPayments() && dueDate != null && dueDate.isBefore(today);
  }

  /** Only DRAFT invoices are editable. */
  public boolean canEdit() {
    return status == InvoiceStatus.DRAFT;
  }

  public Money subtotal() {
    return items.stream()
        .map(InvoiceItem::amountMoney)
        .reduce(Money.zero(currency), Money::add);
  }

  public Money totalMoney() {
    return Money.of(totalAmount, currency);
  }

  public Money taxMoney() {
    return Money.of(taxAmount, currency);
  }

  public Money discountMoney() {
    return Money.of(discountAmount, currency);
  }

  /** Completed payments net of their refunds. */
  public Money completedPayments() {
    return payments.stream()
        .filter(p -> p.getStatus() == PaymentStatus.COMPLETED)
        .map(Payment::netAmount)
        .reduce(Money.zero(currency), Money::add);
  }

  private Money committedPayments() {
    return payments.stream()
        .filter(p -> p.getStatus() == PaymentStatus.PENDING)
        .map(Payment::amountMoney)
        .reduce(completedPayments(), Money::add);
  }

  private void recalculateTotals() {
    Money itemTotal = subtotal();
    this.subtotal = itemTotal.amount();
    this.totalAmount = itemTotal.subtract(discountMoney()).add(taxMoney()).amount();
    this.updatedAt = Instant.now();
  }

  /** Derives the paid status after a payment change. */
  private void settleStatus() {
    InvoiceStatus target =
        completedPayments().compareTo(totalMoney()) >= 0
            ? InvoiceStatus.PAID
            : InvoiceStatus.PARTIALLY_PAID;
    if (target != status && status.canTransitionTo(target)) {
      this.status = target;
    }
    this.updatedAt = Instant.now();
  }

  private Payment requirePayment(UUID paymentId, PaymentStatus expected) {
    Payment payment =
        payments.stream()
            .filter(p -> p.getId().equals(paymentId))
            .findFirst()
            .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));
    if (payment.getStatus() != expected) {
      throw new InvalidStateException(
          "Invalid payment status",
          "Payment " + paymentId + " is " + payment.getStatus() + ", expected " + expected);
    }
    return payment;
  }

  private Money requireInvoiceCurrency(Money amount) {
    if (!currency.equals(amount.currency())) {
      throw new CurrencyMismatchException(currency, amount.currency());
    }
    return amount;
  }

  private void requireDraft() {
    if (!canEdit()) {
      throw new InvoiceNotEditableException(id, status);
    }
  }

  @DomainEvents
  public Collection<BillingDomainEvent> domainEvents() {
    return List.copyOf(domainEvents);
  }

  @AfterDomainEventPublication
  public void clearDomainEvents() {
    domainEvents.clear();
  }

  public UUID getId() {
    return id;
  }

  public String getInvoiceNumber() {
    return invoiceNumber;
  }

  public String getUserId() {
    return userId;
  }

  public BillingPeriod getPeriod() {
    return period;
  }

  public List<InvoiceItem> getItems() {
    return List.copyOf(items);
  }

  public List<Payment> getPayments() {
    return List.copyOf(payments);
  }

  public InvoiceStatus getStatus() {
    return status;
  }

  public String getCurrency() {
    return currency;
  }

  public BigDecimal getSubtotal() {
    return subtotal;
  }

  public BigDecimal getDiscountAmount() {
    return discountAmount;
  }

  public BigDecimal getTaxAmount() {
    return taxAmount;
  }

  public BigDecimal getTotalAmount() {
    return totalAmount;
  }

  public LocalDate getIssueDate() {
    return issueDate;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public String getVoidReason() {
    return voidReason;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Long getVersion() {
    return version;
  }
}
