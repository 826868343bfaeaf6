package io.radbill.billing.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record BillingPlanDeactivatedEvent(UUID planId, String planName, Instant occurredAt)
    implements BillingPlanEvent {

  @Override
  public String eventType() {
    return "billing_plan.deactivated";
  }

  @Override
  public Map<String, Object> details() {
    return Map.of("plan_name", planName);
  }
}
