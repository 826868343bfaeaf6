package io.radbill.billing.invoice;

import io.radbill.billing.config.BillingProperties;
import io.radbill.billing.exception.ResourceConflictException;
import io.radbill.billing.exception.ResourceNotFoundException;
import io.radbill.billing.invoice.dto.InvoiceResponse;
import io.radbill.billing.invoice.dto.PaymentRequest;
import io.radbill.billing.invoice.dto.PaymentResponse;
import io.radbill.billing.invoice.dto.RefundRequest;
import io.radbill.billing.money.Money;
import io.radbill.billing.plan.BillingPlan;
import io.radbill.billing.plan.BillingPlanRepository;
import io.radbill.billing.strategy.BillingStrategyRegistry;
import io.radbill.billing.tax.TaxCalculator;
import io.radbill.billing.tax.TaxContext;
import io.radbill.billing.usage.UsageData;
import io.radbill.billing.usage.UsageDataProvider;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

/**
 * Entry point for invoice operations. Each mutating call loads the invoice under a row lock,
 * applies one aggregate operation and saves it, which publishes the aggregate's events to the
 * outbox in the same transaction.
 */
@Service
@Validated
public class InvoiceService {

  private static final Logger log = LoggerFactory.getLogger(InvoiceService.class);

  /** Unique index allowing one non-void invoice per user and period. */
  static final String OPEN_PERIOD_INDEX = "uq_invoices_user_period_open";

  private final InvoiceRepository invoiceRepository;
  private final BillingPlanRepository billingPlanRepository;
  private final InvoiceNumberService invoiceNumberService;
  private final UsageDataProvider usageDataProvider;
  private final TaxCalculator taxCalculator;
  private final BillingStrategyRegistry strategyRegistry;
  private final BillingProperties billingProperties;
  private final Clock clock;

  public InvoiceService(
      InvoiceRepository invoiceRepository,
      BillingPlanRepository billingPlanRepository,
      InvoiceNumberService invoiceNumberService,
      UsageDataProvider usageDataProvider,
      TaxCalculator taxCalculator,
      BillingStrategyRegistry strategyRegistry,
      BillingProperties billingProperties,
      Clock clock) {
    this.invoiceRepository = invoiceRepository;
    this.billingPlanRepository = billingPlanRepository;
    this.invoiceNumberService = invoiceNumberService;
    this.usageDataProvider = usageDataProvider;
    this.taxCalculator = taxCalculator;
    this.strategyRegistry = strategyRegistry;
    this.billingProperties = billingProperties;
    this.clock = clock;
  }

  /**
   * Creates a draft invoice for the user's usage in {@code period}, priced with the user's plan at
   * today's rates, and applies tax.
   *
   * <p>A concurrent generation for the same user and period is rejected by the unique index on
   * non-void invoices when the insert is flushed.
   *
   * @throws ResourceConflictException if a non-void invoice already exists for the period
   * @throws ResourceNotFoundException if the user has no plan assigned
   */
  @Transactional
  public InvoiceResponse generateInvoice(String userId, BillingPeriod period) {
    if (invoiceRepository.existsByUserIdAndPeriodStartAndPeriodEndAndStatusNot(
        userId, period.start(), period.end(), InvoiceStatus.VOID)) {
      throw new ResourceConflictException(
          "Invoice already exists", "User " + userId + " already has an invoice for " + period);
    }
    BillingPlan plan =
        billingPlanRepository
            .findAssignedToUser(userId)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "No billing plan assigned", "User " + userId + " has no billing plan"));

    UsageData usage = UsageData.combine(userId, usageDataProvider.findUsage(userId, period));
    LocalDate today = LocalDate.now(clock);
    String currency = plan.currency().orElse(billingProperties.defaultCurrency());

    var invoice = new Invoice(userId, period, currency);
    invoice.addBillingItem(usage, plan, strategyRegistry, today);
    invoice.applyTax(taxCalculator, new TaxContext(userId, period, today));

    try {
      invoice = invoiceRepository.saveAndFlush(invoice);
    } catch (DataIntegrityViolationException e) {
      if (!isOpenPeriodViolation(e)) {
        throw e;
      }
      log.warn("Concurrent invoice generation for user={} period={}", userId, period);
      throw new ResourceConflictException(
          "Invoice already exists",
          "User " + userId + " already has an invoice for " + period,
          e);
    }
    log.info(
        "Generated invoice {} for user={} period={} plan={} total={}",
        invoice.getId(),
        userId,
        period,
        plan.getName(),
        invoice.totalMoney());
    return InvoiceResponse.from(invoice, today);
  }

  /** Sets the discount of a draft invoice and re-applies tax to the discounted subtotal. */
  @Transactional
  public InvoiceResponse applyDiscount(
      UUID invoiceId,
      @NotNull @PositiveOrZero @Digits(integer = 15, fraction = 2) BigDecimal amount) {
    var invoice = lockInvoice(invoiceId);
    LocalDate today = LocalDate.now(clock);
    invoice.applyDiscount(Money.of(amount, invoice.getCurrency()));
    invoice.applyTax(
        taxCalculator, new TaxContext(invoice.getUserId(), invoice.getPeriod(), today));
    invoice = invoiceRepository.save(invoice);
    log.info(
        "Applied discount {} to invoice {} total={}",
        invoice.discountMoney(),
        invoiceId,
        invoice.totalMoney());
    return InvoiceResponse.from(invoice, today);
  }

  /** Assigns the next invoice number and sends the invoice with the configured payment terms. */
  @Transactional
  public InvoiceResponse markAsSent(UUID invoiceId) {
    var invoice = lockInvoice(invoiceId);
    LocalDate today = LocalDate.now(clock);
    String invoiceNumber = invoiceNumberService.assignNumber();
    invoice.markAsSent(invoiceNumber, today, today.plusDays(billingProperties.paymentTermsDays()));
    invoice = invoiceRepository.save(invoice);
    log.info("Sent invoice {} as {} status={}", invoiceId, invoiceNumber, invoice.getStatus());
    return InvoiceResponse.from(invoice, today);
  }

  @Transactional
  public PaymentResponse recordPayment(UUID invoiceId, @Valid PaymentRequest request) {
    var invoice = lockInvoice(invoiceId);
    String currency = request.currency() != null ? request.currency() : invoice.getCurrency();
    var payment =
        new Payment(
            invoiceId,
            invoiceNumberService.newPaymentNumber(),
            Money.of(request.amount(), currency),
            request.method(),
            request.transactionRef(),
            request.status() != null ? request.status() : PaymentStatus.COMPLETED,
            request.paidAt() != null ? request.paidAt() : clock.instant(),
            request.notes());
    invoice.recordPayment(payment);
    invoice = invoiceRepository.save(invoice);
    log.info(
        "Recorded payment {} of {} on invoice {} status={}",
        payment.getPaymentNumber(),
        payment.amountMoney(),
        invoiceId,
        invoice.getStatus());
    return PaymentResponse.from(invoiceId, payment);
  }

  @Transactional
  public InvoiceResponse completePayment(UUID invoiceId, UUID paymentId) {
    var invoice = lockInvoice(invoiceId);
    invoice.completePayment(paymentId);
    invoice = invoiceRepository.save(invoice);
    log.info("Completed payment {} on invoice {}", paymentId, invoiceId);
    return InvoiceResponse.from(invoice, LocalDate.now(clock));
  }

  @Transactional
  public InvoiceResponse failPayment(UUID invoiceId, UUID paymentId, String reason) {
    var invoice = lockInvoice(invoiceId);
    invoice.failPayment(paymentId, reason);
    invoice = invoiceRepository.save(invoice);
    log.warn("Payment {} on invoice {} failed: {}", paymentId, invoiceId, reason);
    return InvoiceResponse.from(invoice, LocalDate.now(clock));
  }

  /** Refunds part or, when the request has no amount, all of what is left of a payment. */
  @Transactional
  public InvoiceResponse refundPayment(
      UUID invoiceId, UUID paymentId, @Valid RefundRequest request) {
    var invoice = lockInvoice(invoiceId);
    Money amount =
        request.amount() != null
            ? Money.of(request.amount(), invoice.getCurrency())
            : invoice.refundableAmount(paymentId);
    var refund =
        invoice.refundPayment(
            paymentId, amount, invoiceNumberService.newRefundNumber(), request.reason());
    invoice = invoiceRepository.save(invoice);
    log.info(
        "Refunded {} of payment {} on invoice {} as {} status={}",
        refund.amountMoney(),
        paymentId,
        invoiceId,
        refund.getRefundNumber(),
        invoice.getStatus());
    return InvoiceResponse.from(invoice, LocalDate.now(clock));
  }

  @Transactional(readOnly = true)
  public Money getBalanceDue(UUID invoiceId) {
    return findInvoiceEntity(invoiceId).getBalanceDue();
  }

  @Transactional
  public InvoiceResponse voidInvoice(UUID invoiceId, String reason) {
    var invoice = lockInvoice(invoiceId);
    invoice.voidInvoice(reason);
    invoice = invoiceRepository.save(invoice);
    log.info(
        "Voided invoice {} reason={} refundDue={}", invoiceId, reason, invoice.getRefundDue());
    return InvoiceResponse.from(invoice, LocalDate.now(clock));
  }

  @Transactional(readOnly = true)
  public InvoiceResponse findInvoice(UUID invoiceId) {
    return InvoiceResponse.from(findInvoiceEntity(invoiceId), LocalDate.now(clock));
  }

  @Transactional(readOnly = true)
  public List<InvoiceResponse> findInvoicesByUser(String userId, InvoiceFilter filter) {
    LocalDate today = LocalDate.now(clock);
    return invoiceRepository
        .findByUser(userId, filter != null ? filter : InvoiceFilter.none())
        .stream()
        .map(invoice -> InvoiceResponse.from(invoice, today))
        .toList();
  }

  /** Outstanding balance per currency over the user's sent invoices. */
  @Transactional(readOnly = true)
  public Map<String, Money> calculateUserBalance(String userId) {
    return invoiceRepository.calculateUserBalance(userId);
  }

  @Transactional(readOnly = true)
  public List<InvoiceResponse> findOverdueInvoices() {
    LocalDate today = LocalDate.now(clock);
    return invoiceRepository
        .findDueBefore(List.of(InvoiceStatus.SENT, InvoiceStatus.PARTIALLY_PAID), today)
        .stream()
        .map(invoice -> InvoiceResponse.from(invoice, today))
        .toList();
  }

  private static boolean isOpenPeriodViolation(DataIntegrityViolationException e) {
    String message = e.getMostSpecificCause().getMessage();
    return message != null && message.contains(OPEN_PERIOD_INDEX);
  }

  private Invoice findInvoiceEntity(UUID invoiceId) {
    return invoiceRepository
        .findById(invoiceId)
        .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
  }

  private Invoice lockInvoice(UUID invoiceId) {
    return invoiceRepository
        .findByIdForUpdate(invoiceId)
        .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
  }
}
