package io.radbill.billing.plan.dto;

import io.radbill.billing.plan.BillingPlan;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record BillingPlanResponse(
    UUID id,
    String name,
    String description,
    String strategyId,
    boolean active,
    List<RateResponse> rates,
    Instant createdAt,
    Instant updatedAt) {

  public static BillingPlanResponse from(BillingPlan plan) {
    return new BillingPlanResponse(
        plan.getId(),
        plan.getName(),
        plan.getDescription(),
        plan.getStrategyId(),
        plan.isActive(),
        plan.getRates().stream().map(RateResponse::from).toList(),
        plan.getCreatedAt(),
        plan.getUpdatedAt());
  }
}
