package io.radbill.billing.strategy;

import io.radbill.billing.money.Money;
import java.math.BigDecimal;
import java.util.List;

/**
 * Output of a billing strategy. {@code baseAmount} is exact and unrounded; the invoice rounds it
 * when the item's amount is fixed.
 *
 * @param baseAmount the charge before tax
 * @param quantity billable units (minutes, data units, periods)
 * @param unitPrice price of one billable unit, blended for tiered pricing
 * @param description human readable summary for the invoice item
 * @param breakdown one line per pricing step
 */
public record BillingResult(
    Money baseAmount,
    BigDecimal quantity,
    BigDecimal unitPrice,
    String description,
    List<BreakdownLine> breakdown) {

  public BillingResult {
    breakdown = List.copyOf(breakdown);
  }

  /** One pricing step of a charge, e.g. a single tier. */
  public record BreakdownLine(
      String label, BigDecimal quantity, BigDecimal unitPrice, BigDecimal amount) {}
}
