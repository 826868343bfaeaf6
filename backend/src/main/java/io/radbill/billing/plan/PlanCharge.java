package io.radbill.billing.plan;

import io.radbill.billing.rate.Rate;
import io.radbill.billing.strategy.BillingResult;

/** A charge priced by a plan, together with the strategy and rate that produced it. */
public record PlanCharge(String strategyId, Rate rate, BillingResult result) {}
