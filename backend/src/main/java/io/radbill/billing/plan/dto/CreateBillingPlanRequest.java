package io.radbill.billing.plan.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateBillingPlanRequest(
    @NotBlank @Size(min = 2, max = 128) String name,
    String description,
    @NotBlank String strategyId) {}
