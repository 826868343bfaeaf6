package io.radbill.billing.invoice;

import static io.radbill.billing.BillingFixtures.TODAY;
import static io.radbill.billing.BillingFixtures.flatPlan;
import static io.radbill.billing.BillingFixtures.timePlan;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.radbill.billing.config.BillingProperties;
import io.radbill.billing.exception.InvalidStateException;
import io.radbill.billing.exception.OverpaymentException;
import io.radbill.billing.exception.ResourceConflictException;
import io.radbill.billing.exception.ResourceNotFoundException;
import io.radbill.billing.invoice.dto.PaymentRequest;
import io.radbill.billing.invoice.dto.RefundRequest;
import io.radbill.billing.money.Money;
import io.radbill.billing.plan.BillingPlanRepository;
import io.radbill.billing.strategy.BillingStrategyRegistry;
import io.radbill.billing.tax.PercentageTaxCalculator;
import io.radbill.billing.tax.TaxContext;
import io.radbill.billing.usage.UsageData;
import io.radbill.billing.usage.UsageDataProvider;
import java.math.BigDecimal;
import java.sql.SQLException;
import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class InvoiceServiceTest {

  private static final String USER = "alice";
  private static final BillingPeriod JANUARY = BillingPeriod.ofMonth(YearMonth.of(2024, 1));
  private static final Clock CLOCK =
      Clock.fixed(TODAY.atTime(9, 30).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

  @Mock private InvoiceRepository invoiceRepository;
  @Mock private BillingPlanRepository billingPlanRepository;
  @Mock private InvoiceNumberService invoiceNumberService;
  @Mock private UsageDataProvider usageDataProvider;

  private final BillingStrategyRegistry registry = BillingStrategyRegistry.defaults();
  private InvoiceService service;

  @BeforeEach
  void setUp() {
    service =
        new InvoiceService(
            invoiceRepository,
            billingPlanRepository,
            invoiceNumberService,
            usageDataProvider,
            new PercentageTaxCalculator(new BigDecimal("10")),
            registry,
            new BillingProperties("USD", 30, null),
            CLOCK);
  }

  // --- generateInvoice ---

  @Test
  void generateInvoice_combinesSessionsAndAppliesTax() {
    when(billingPlanRepository.findAssignedToUser(USER)).thenReturn(Optional.of(timePlan("12.00")));
    when(usageDataProvider.findUsage(USER, JANUARY))
        .thenReturn(List.of(UsageData.ofSession(USER, 60, 0), UsageData.ofSession(USER, 65, 0)));
    when(invoiceRepository.saveAndFlush(any(Invoice.class))).thenAnswer(i -> i.getArgument(0));

    var response = service.generateInvoice(USER, JANUARY);

    // 125 s -> 3 minutes at 12.00/h
    assertThat(response.status()).isEqualTo(InvoiceStatus.DRAFT);
    assertThat(response.subtotal()).isEqualByComparingTo("0.60");
    assertThat(response.taxAmount()).isEqualByComparingTo("0.06");
    assertThat(response.totalAmount()).isEqualByComparingTo("0.66");
    assertThat(response.items()).hasSize(1);
    assertThat(response.currency()).isEqualTo("USD");
  }

  @Test
  void generateInvoice_withoutUsage_stillChargesFlatFee() {
    when(billingPlanRepository.findAssignedToUser(USER))
        .thenReturn(Optional.of(flatPlan("Basic", "10.00")));
    when(usageDataProvider.findUsage(USER, JANUARY)).thenReturn(List.of());
    when(invoiceRepository.saveAndFlush(any(Invoice.class))).thenAnswer(i -> i.getArgument(0));

    var response = service.generateInvoice(USER, JANUARY);

    assertThat(response.totalAmount()).isEqualByComparingTo("11.00");
    assertThat(response.balanceDue()).isEqualByComparingTo("11.00");
  }

  @Test
  void generateInvoice_existingInvoiceForPeriod_throwsConflict() {
    when(invoiceRepository.existsByUserIdAndPeriodStartAndPeriodEndAndStatusNot(
            USER, JANUARY.start(), JANUARY.end(), InvoiceStatus.VOID))
        .thenReturn(true);

    assertThatThrownBy(() -> service.generateInvoice(USER, JANUARY))
        .isInstanceOf(ResourceConflictException.class);
    verify(usageDataProvider, never()).findUsage(any(), any());
    verify(invoiceRepository, never()).saveAndFlush(any());
  }

  @Test
  void generateInvoice_userWithoutPlan_throwsNotFound() {
    when(billingPlanRepository.findAssignedToUser(USER)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.generateInvoice(USER, JANUARY))
        .isInstanceOf(ResourceNotFoundException.class)
        .hasMessageContaining("No billing plan assigned");
    verify(invoiceRepository, never()).saveAndFlush(any());
  }

  @Test
  void generateInvoice_concurrentInsertForSamePeriod_throwsConflict() {
    when(billingPlanRepository.findAssignedToUser(USER))
        .thenReturn(Optional.of(flatPlan("Basic", "10.00")));
    when(usageDataProvider.findUsage(USER, JANUARY)).thenReturn(List.of());
    when(invoiceRepository.saveAndFlush(any(Invoice.class)))
        .thenThrow(
            new DataIntegrityViolationException(
                "could not execute statement",
                new SQLException(
                    "ERROR: duplicate key value violates unique constraint \""
                        + InvoiceService.OPEN_PERIOD_INDEX
                        + "\"")));

    assertThatThrownBy(() -> service.generateInvoice(USER, JANUARY))
        .isInstanceOf(ResourceConflictException.class)
        .hasMessageContaining("already has an invoice")
        .hasCauseInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  void generateInvoice_otherIntegrityViolation_propagates() {
    when(billingPlanRepository.findAssignedToUser(USER))
        .thenReturn(Optional.of(flatPlan("Basic", "10.00")));
    when(usageDataProvider.findUsage(USER, JANUARY)).thenReturn(List.of());
    var violation =
        new DataIntegrityViolationException(
            "could not execute statement",
            new SQLException("ERROR: new row violates check constraint \"chk_invoices_total\""));
    when(invoiceRepository.saveAndFlush(any(Invoice.class))).thenThrow(violation);

    assertThatThrownBy(() -> service.generateInvoice(USER, JANUARY)).isSameAs(violation);
  }

  // --- applyDiscount ---

  @Test
  void applyDiscount_reappliesTaxToDiscountedSubtotal() {
    var invoice = draftInvoice();
    when(invoiceRepository.findByIdForUpdate(invoice.getId())).thenReturn(Optional.of(invoice));
    when(invoiceRepository.save(invoice)).thenReturn(invoice);

    var response = service.applyDiscount(invoice.getId(), new BigDecimal("4.00"));

    assertThat(response.subtotal()).isEqualByComparingTo("10.00");
    assertThat(response.discountAmount()).isEqualByComparingTo("4.00");
    assertThat(response.taxAmount()).isEqualByComparingTo("0.60");
    assertThat(response.totalAmount()).isEqualByComparingTo("6.60");
  }

  // --- markAsSent ---

  @Test
  void markAsSent_assignsNumberAndPaymentTerms() {
    var invoice = draftInvoice();
    when(invoiceRepository.findByIdForUpdate(invoice.getId())).thenReturn(Optional.of(invoice));
    when(invoiceNumberService.assignNumber()).thenReturn("INV-0007");
    when(invoiceRepository.save(invoice)).thenReturn(invoice);

    var response = service.markAsSent(invoice.getId());

    assertThat(response.invoiceNumber()).isEqualTo("INV-0007");
    assertThat(response.status()).isEqualTo(InvoiceStatus.SENT);
    assertThat(response.issueDate()).isEqualTo(TODAY);
    assertThat(response.dueDate()).isEqualTo(TODAY.plusDays(30));
    assertThat(response.overdue()).isFalse();
  }

  @Test
  void markAsSent_unknownInvoice_throwsNotFound() {
    var id = UUID.randomUUID();
    when(invoiceRepository.findByIdForUpdate(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.markAsSent(id))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(invoiceNumberService, never()).assignNumber();
  }

  // --- payments ---

  @Test
  void recordPayment_defaultsToCompletedInInvoiceCurrency() {
    var invoice = sentInvoice();
    when(invoiceRepository.findByIdForUpdate(invoice.getId())).thenReturn(Optional.of(invoice));
    when(invoiceNumberService.newPaymentNumber()).thenReturn("PAY-20240215093000-ABCD");
    when(invoiceRepository.save(invoice)).thenReturn(invoice);

    var response =
        service.recordPayment(
            invoice.getId(),
            PaymentRequest.completed(new BigDecimal("11.00"), PaymentMethod.CREDIT_CARD, "ch_1"));

    assertThat(response.status()).isEqualTo(PaymentStatus.COMPLETED);
    assertThat(response.currency()).isEqualTo("USD");
    assertThat(response.paymentNumber()).isEqualTo("PAY-20240215093000-ABCD");
    assertThat(response.paidAt()).isEqualTo(CLOCK.instant());
    assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.PAID);
  }

  @Test
  void recordPayment_overpayment_doesNotSave() {
    var invoice = sentInvoice();
    when(invoiceRepository.findByIdForUpdate(invoice.getId())).thenReturn(Optional.of(invoice));
    when(invoiceNumberService.newPaymentNumber()).thenReturn("PAY-1");

    assertThatThrownBy(
            () ->
                service.recordPayment(
                    invoice.getId(),
                    PaymentRequest.completed(new BigDecimal("20.00"), PaymentMethod.CASH, null)))
        .isInstanceOf(OverpaymentException.class);
    verify(invoiceRepository, never()).save(any());
    assertThat(invoice.getBalanceDue()).isEqualTo(Money.of("11.00", "USD"));
  }

  @Test
  void pendingPayment_canBeCompletedLater() {
    var invoice = sentInvoice();
    when(invoiceRepository.findByIdForUpdate(invoice.getId())).thenReturn(Optional.of(invoice));
    when(invoiceNumberService.newPaymentNumber()).thenReturn("PAY-1");
    when(invoiceRepository.save(invoice)).thenReturn(invoice);
    var request =
        new PaymentRequest(
            new BigDecimal("11.00"),
            null,
            PaymentMethod.BANK_TRANSFER,
            "wire-42",
            PaymentStatus.PENDING,
            null,
            null);

    var payment = service.recordPayment(invoice.getId(), request);
    assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.PARTIALLY_PAID);

    var response = service.completePayment(invoice.getId(), payment.id());

    assertThat(response.status()).isEqualTo(InvoiceStatus.PAID);
    assertThat(response.balanceDue()).isEqualByComparingTo("0");
  }

  @Test
  void refundPayment_partialThenRemainder() {
    var invoice = sentInvoice();
    var payment = completedPayment(invoice, "11.00");
    invoice.recordPayment(payment);
    when(invoiceRepository.findByIdForUpdate(invoice.getId())).thenReturn(Optional.of(invoice));
    when(invoiceNumberService.newRefundNumber())
        .thenReturn("REF-20240215093000-0001", "REF-20240215093000-0002");
    when(invoiceRepository.save(invoice)).thenReturn(invoice);

    var partial =
        service.refundPayment(
            invoice.getId(), payment.getId(), new RefundRequest(new BigDecimal("3.00"), "outage"));

    assertThat(partial.status()).isEqualTo(InvoiceStatus.PARTIALLY_PAID);
    assertThat(partial.amountPaid()).isEqualByComparingTo("8.00");
    assertThat(partial.balanceDue()).isEqualByComparingTo("3.00");
    assertThat(partial.payments().get(0).refunds())
        .singleElement()
        .satisfies(r -> assertThat(r.refundNumber()).isEqualTo("REF-20240215093000-0001"));

    var rest =
        service.refundPayment(invoice.getId(), payment.getId(), RefundRequest.full("cancelled"));

    assertThat(rest.amountPaid()).isEqualByComparingTo("0");
    assertThat(rest.payments().get(0).status()).isEqualTo(PaymentStatus.REFUNDED);
    assertThat(rest.payments().get(0).refundedAmount()).isEqualByComparingTo("11.00");
  }

  @Test
  void voidInvoice_withCompletedPayment_reportsRefundDue() {
    var invoice = sentInvoice();
    invoice.recordPayment(completedPayment(invoice, "5.00"));
    when(invoiceRepository.findByIdForUpdate(invoice.getId())).thenReturn(Optional.of(invoice));
    when(invoiceRepository.save(invoice)).thenReturn(invoice);

    var response = service.voidInvoice(invoice.getId(), "customer left");

    assertThat(response.status()).isEqualTo(InvoiceStatus.VOID);
    assertThat(response.refundDue()).isEqualByComparingTo("5.00");
  }

  @Test
  void voidInvoice_paidInvoice_isRefused() {
    var invoice = sentInvoice();
    invoice.recordPayment(completedPayment(invoice, "11.00"));
    when(invoiceRepository.findByIdForUpdate(invoice.getId())).thenReturn(Optional.of(invoice));

    assertThatThrownBy(() -> service.voidInvoice(invoice.getId(), "duplicate"))
        .isInstanceOf(InvalidStateException.class);
    verify(invoiceRepository, never()).save(any());
  }

  // --- queries ---

  @Test
  void findInvoicesByUser_appliesFilter() {
    var draft = draftInvoice();
    var sent = sentInvoice();
    when(invoiceRepository.findByUserIdOrderByPeriodStartDesc(USER))
        .thenReturn(List.of(draft, sent));
    when(invoiceRepository.findByUser(any(), any())).thenCallRealMethod();

    var result = service.findInvoicesByUser(USER, InvoiceFilter.byStatus(InvoiceStatus.SENT));

    assertThat(result).extracting(r -> r.id()).containsExactly(sent.getId());
  }

  @Test
  void findOverdueInvoices_flagsInvoicesPastDueDate() {
    var invoice = draftInvoice();
    invoice.markAsSent("INV-0001", TODAY.minusDays(40), TODAY.minusDays(10));
    when(invoiceRepository.findDueBefore(any(), any())).thenReturn(List.of(invoice));

    var result = service.findOverdueInvoices();

    assertThat(result).singleElement().satisfies(r -> assertThat(r.overdue()).isTrue());
  }

  private Invoice draftInvoice() {
    var invoice = new Invoice(USER, JANUARY, "USD");
    invoice.addBillingItem(UsageData.none(USER), flatPlan("Basic", "10.00"), registry, TODAY);
    invoice.applyTax(
        new PercentageTaxCalculator(new BigDecimal("10")), new TaxContext(USER, JANUARY, TODAY));
    invoice.clearDomainEvents();
    return invoice;
  }

  private Invoice sentInvoice() {
    var invoice = draftInvoice();
    invoice.markAsSent("INV-0001", TODAY, TODAY.plusDays(30));
    return invoice;
  }

  private static Payment completedPayment(Invoice invoice, String amount) {
    return new Payment(
        invoice.getId(),
        "PAY-" + amount,
        Money.of(amount, "USD"),
        PaymentMethod.CASH,
        null,
        PaymentStatus.COMPLETED,
        CLOCK.instant(),
        null);
  }
}
