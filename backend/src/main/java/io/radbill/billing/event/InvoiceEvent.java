package io.radbill.billing.event;

import java.util.UUID;

/** Events emitted by the invoice aggregate. */
public sealed interface InvoiceEvent extends BillingDomainEvent
    permits InvoiceCreatedEvent,
        InvoiceItemAddedEvent,
        InvoiceDiscountAppliedEvent,
        InvoiceTaxAppliedEvent,
        InvoiceSentEvent,
        InvoiceVoidedEvent,
        PaymentRecordedEvent,
        PaymentCompletedEvent,
        PaymentFailedEvent,
        PaymentRefundedEvent {

  UUID invoiceId();

  @Override
  default String aggregateType() {
    return "invoice";
  }

  @Override
  default UUID aggregateId() {
    return invoiceId();
  }
}
