package io.radbill.billing.event;

import java.util.UUID;

/** Events emitted by the billing plan aggregate. */
public sealed interface BillingPlanEvent extends BillingDomainEvent
    permits BillingPlanActivatedEvent, BillingPlanDeactivatedEvent, RateAddedEvent {

  UUID planId();

  @Override
  default String aggregateType() {
    return "billing_plan";
  }

  @Override
  default UUID aggregateId() {
    return planId();
  }
}
