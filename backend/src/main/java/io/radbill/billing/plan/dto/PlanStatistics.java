package io.radbill.billing.plan.dto;

public record PlanStatistics(long totalPlans, long activePlans, long inactivePlans) {}
