package io.radbill.billing.invoice;

import io.radbill.billing.money.Money;
import io.radbill.billing.plan.PlanCharge;
import io.radbill.billing.strategy.BillingResult;
import io.radbill.billing.usage.UsageData;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One charged line of an invoice. The owning {@link Invoice} is the only writer; items cannot be
 * changed once the invoice has been sent.
 *
 * <p>{@code billingDetails} is a snapshot of how the amount was priced (strategy, rate and
 * breakdown), so the item stays explainable even if the plan changes later.
 */
@Entity
@Table(name = "invoice_items")
public class InvoiceItem {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "description", nullable = false, columnDefinition = "TEXT")
  private String description;

  @Column(name = "quantity", nullable = false, precision = 19, scale = 6)
  private BigDecimal quantity;

  @Column(name = "unit_price", nullable = false, precision = 19, scale = 6)
  private BigDecimal unitPrice;

  @Column(name = "amount", nullable = false, precision = 19, scale = 4)
  private BigDecimal amount;

  @Column(name = "tax_amount", nullable = false, precision = 19, scale = 4)
  private BigDecimal taxAmount = BigDecimal.ZERO;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "billing_details", columnDefinition = "jsonb")
  private Map<String, Object> billingDetails;

  @Column(name = "sort_order", nullable = false)
  private int sortOrder;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected InvoiceItem() {}

  InvoiceItem(
      String description,
      BigDecimal quantity,
      BigDecimal unitPrice,
      Money amount,
      Map<String, Object> billingDetails,
      int sortOrder) {
    this.description = description;
    this.quantity = quantity;
    this.unitPrice = unitPrice;
    this.amount = amount.amount();
    this.currency = amount.currency();
    this.billingDetails = billingDetails;
    this.sortOrder = sortOrder;
    this.createdAt = Instant.now();
  }

  /** Builds the item for a priced charge; the amount is rounded to the currency's precision. */
  static InvoiceItem fromCharge(UsageData usage, PlanCharge charge, int sortOrder) {
    BillingResult result = charge.result();
    return new InvoiceItem(
        result.description(),
        result.quantity(),
        result.unitPrice(),
        result.baseAmount().rounded(),
        billingDetails(usage, charge),
        sortOrder);
  }

  private static Map<String, Object> billingDetails(UsageData usage, PlanCharge charge) {
    var details = new LinkedHashMap<String, Object>();
    details.put("strategy_id", charge.strategyId());
    details.put("rate_id", String.valueOf(charge.rate().getId()));
    details.put("rate_name", charge.rate().getName());
    details.put("rate_type", charge.rate().getRateType().name());
    details.put("session_seconds", usage.sessionSeconds());
    details.put("total_bytes", usage.totalBytes());
    details.put("session_count", usage.sessionCount());
    details.put("unrounded_amount", charge.result().baseAmount().amount().toPlainString());
    List<Map<String, Object>> breakdown =
        charge.result().breakdown().stream()
            .map(
                line ->
                    Map.<String, Object>of(
                        "label", line.label(),
                        "quantity", line.quantity().toPlainString(),
                        "unit_price", line.unitPrice().toPlainString(),
                        "amount", line.amount().toPlainString()))
            .toList();
    details.put("breakdown", breakdown);
    return details;
  }

  void setTaxAmount(Money taxAmount) {
    this.taxAmount = taxAmount.amount();
  }

  public Money amountMoney() {
    return Money.of(amount, currency);
  }

  public UUID getId() {
    return id;
  }

  public String getDescription() {
    return description;
  }

  public BigDecimal getQuantity() {
    return quantity;
  }

  public BigDecimal getUnitPrice() {
    return unitPrice;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public BigDecimal getTaxAmount() {
    return taxAmount;
  }

  public String getCurrency() {
    return currency;
  }

  public Map<String, Object> getBillingDetails() {
    return billingDetails;
  }

  public int getSortOrder() {
    return sortOrder;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
