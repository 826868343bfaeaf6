package io.radbill.billing.run;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.when;

import io.radbill.billing.config.BillingProperties;
import io.radbill.billing.exception.InactivePlanException;
import io.radbill.billing.exception.ResourceConflictException;
import io.radbill.billing.invoice.BillingPeriod;
import io.radbill.billing.invoice.Invoice;
import io.radbill.billing.invoice.InvoiceService;
import io.radbill.billing.invoice.dto.InvoiceResponse;
import io.radbill.billing.plan.PlanAssignmentRepository;
import io.radbill.billing.run.BillingRunResult.Status;
import io.radbill.billing.run.BillingRunResult.UserOutcome;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BillingRunServiceTest {

  private static final BillingPeriod JANUARY = BillingPeriod.ofMonth(YearMonth.of(2024, 1));

  @Mock private PlanAssignmentRepository planAssignmentRepository;
  @Mock private InvoiceService invoiceService;

  @Test
  void runBillingCycle_reportsOutcomePerUser() {
    when(planAssignmentRepository.findAllUserIds()).thenReturn(List.of("alice", "bob", "carol"));
    var aliceInvoice = draftResponse("alice");
    when(invoiceService.generateInvoice("alice", JANUARY)).thenReturn(aliceInvoice);
    when(invoiceService.generateInvoice("bob", JANUARY))
        .thenThrow(new ResourceConflictException("Invoice already exists", "bob has one"));
    when(invoiceService.generateInvoice("carol", JANUARY))
        .thenThrow(new InactivePlanException("Legacy"));

    var result = service(Runnable::run, Duration.ofSeconds(5)).runBillingCycle(JANUARY);

    assertThat(result.outcomes())
        .extracting(UserOutcome::userId, UserOutcome::status)
        .containsExactly(
            tuple("alice", Status.GENERATED),
            tuple("bob", Status.SKIPPED),
            tuple("carol", Status.FAILED));
    assertThat(result.outcomes().get(0).invoiceId()).isEqualTo(aliceInvoice.id());
    assertThat(result.failures())
        .singleElement()
        .satisfies(f -> assertThat(f.error()).contains("Legacy"));
  }

  @Test
  void runBillingCycle_unexpectedErrorFailsOnlyThatUser() {
    when(planAssignmentRepository.findAllUserIds()).thenReturn(List.of("alice", "bob"));
    when(invoiceService.generateInvoice("alice", JANUARY))
        .thenThrow(new IllegalStateException("connection refused"));
    when(invoiceService.generateInvoice("bob", JANUARY)).thenReturn(draftResponse("bob"));

    var result = service(Runnable::run, Duration.ofSeconds(5)).runBillingCycle(JANUARY);

    assertThat(result.count(Status.FAILED)).isEqualTo(1);
    assertThat(result.count(Status.GENERATED)).isEqualTo(1);
    assertThat(result.failures().get(0).error()).contains("connection refused");
  }

  @Test
  void runBillingCycle_userExceedingTimeout_isReportedFailed() {
    when(planAssignmentRepository.findAllUserIds()).thenReturn(List.of("alice"));
    // tasks are accepted but never run
    Executor stalled = task -> {};

    var result = service(stalled, Duration.ofMillis(50)).runBillingCycle(JANUARY);

    assertThat(result.failures())
        .singleElement()
        .satisfies(f -> assertThat(f.error()).startsWith("Timed out"));
  }

  @Test
  void runBillingCycle_noAssignedUsers_yieldsEmptyResult() {
    when(planAssignmentRepository.findAllUserIds()).thenReturn(List.of());

    var result = service(Runnable::run, Duration.ofSeconds(5)).runBillingCycle(JANUARY);

    assertThat(result.outcomes()).isEmpty();
    assertThat(result.period()).isEqualTo(JANUARY);
  }

  private BillingRunService service(Executor executor, Duration perUserTimeout) {
    return new BillingRunService(
        planAssignmentRepository,
        invoiceService,
        executor,
        new BillingProperties("USD", 30, new BillingProperties.Run(1, perUserTimeout)),
        Clock.systemUTC());
  }

  private static InvoiceResponse draftResponse(String userId) {
    return InvoiceResponse.from(new Invoice(userId, JANUARY, "USD"), LocalDate.of(2024, 2, 1));
  }
}
