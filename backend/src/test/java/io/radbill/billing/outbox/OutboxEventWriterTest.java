package io.radbill.billing.outbox;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.radbill.billing.event.BillingPlanDeactivatedEvent;
import io.radbill.billing.event.InvoiceVoidedEvent;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OutboxEventWriterTest {

  @Mock private OutboxEventRepository outboxEventRepository;

  private OutboxEventWriter writer;

  @BeforeEach
  void setUp() {
    writer = new OutboxEventWriter(outboxEventRepository);
  }

  @Test
  void onDomainEvent_persistsInvoiceEvent() {
    var invoiceId = UUID.randomUUID();
    var occurredAt = Instant.parse("2024-02-15T10:00:00Z");

    writer.onDomainEvent(
        new InvoiceVoidedEvent(
            invoiceId, "PARTIALLY_PAID", "duplicate", new BigDecimal("5.00"), "USD", occurredAt));

    var captor = ArgumentCaptor.forClass(OutboxEvent.class);
    verify(outboxEventRepository).save(captor.capture());
    var saved = captor.getValue();
    assertThat(saved.getAggregateType()).isEqualTo("invoice");
    assertThat(saved.getAggregateId()).isEqualTo(invoiceId);
    assertThat(saved.getEventType()).isEqualTo("invoice.voided");
    assertThat(saved.getPayload())
        .containsEntry("previous_status", "PARTIALLY_PAID")
        .containsEntry("reason", "duplicate")
        .containsEntry("refund_due", "5.00");
    assertThat(saved.getOccurredAt()).isEqualTo(occurredAt);
    assertThat(saved.isPublished()).isFalse();
  }

  @Test
  void onDomainEvent_persistsPlanEvent() {
    var planId = UUID.randomUUID();

    writer.onDomainEvent(new BillingPlanDeactivatedEvent(planId, "Legacy", Instant.now()));

    var captor = ArgumentCaptor.forClass(OutboxEvent.class);
    verify(outboxEventRepository).save(captor.capture());
    assertThat(captor.getValue().getAggregateType()).isEqualTo("billing_plan");
    assertThat(captor.getValue().getEventType()).isEqualTo("billing_plan.deactivated");
  }

  @Test
  void onDomainEvent_saveFailurePropagates() {
    when(outboxEventRepository.save(any(OutboxEvent.class)))
        .thenThrow(new IllegalStateException("database unavailable"));

    assertThatThrownBy(
            () ->
                writer.onDomainEvent(
                    new BillingPlanDeactivatedEvent(UUID.randomUUID(), "Legacy", Instant.now())))
        .isInstanceOf(IllegalStateException.class);
  }
}
