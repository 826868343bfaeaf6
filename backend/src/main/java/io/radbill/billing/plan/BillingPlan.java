package io.radbill.billing.plan;

import io.radbill.billing.event.BillingDomainEvent;
import io.radbill.billing.event.BillingPlanActivatedEvent;
import io.radbill.billing.event.BillingPlanDeactivatedEvent;
import io.radbill.billing.event.RateAddedEvent;
import io.radbill.billing.exception.CurrencyMismatchException;
import io.radbill.billing.exception.InactivePlanException;
import io.radbill.billing.exception.MissingRateException;
import io.radbill.billing.exception.NoApplicableRateException;
import io.radbill.billing.exception.RateConflictException;
import io.radbill.billing.exception.ValidationException;
import io.radbill.billing.rate.Rate;
import io.radbill.billing.rate.RateType;
import io.radbill.billing.strategy.BillingResult;
import io.radbill.billing.strategy.BillingStrategy;
import io.radbill.billing.strategy.BillingStrategyRegistry;
import io.radbill.billing.usage.UsageData;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import jakarta.persistence.Version;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.AfterDomainEventPublication;
import org.springframework.data.domain.DomainEvents;

/**
 * A billing plan binds one billing strategy to the rates it prices with. Plans are never deleted,
 * only deactivated, so the invoices produced under them stay explainable.
 *
 * <p>Rates of the same type may not overlap in time, and all rates of a plan share one currency.
 * Each state change records a {@link BillingDomainEvent} which is published when the plan is saved
 * through its repository.
 */
@Entity
@Table(name = "billing_plans")
public class BillingPlan {

  @Id private UUID id;

  @Column(name = "name", nullable = false, unique = true, length = 128)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "strategy_id", nullable = false, length = 50)
  private String strategyId;

  @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true)
  @JoinColumn(name = "plan_id", nullable = false)
  @OrderBy("effectiveFrom ASC")
  private List<Rate> rates = new ArrayList<>();

  @Column(name = "active", nullable = false)
  private boolean active = true;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version
  @Column(name = "version")
  private Long version;

  @Transient private final List<BillingDomainEvent> domainEvents = new ArrayList<>();

  protected BillingPlan() {}

  public BillingPlan(String name, String description, String strategyId) {
    if (name == null || name.isBlank()) {
      throw new ValidationException("Invalid plan name", "Plan name must not be blank");
    }
    if (strategyId == null || strategyId.isBlank()) {
      throw new ValidationException("Invalid strategy", "Strategy id must not be blank");
    }
    this.id = UUID.randomUUID();
    this.name = name.strip();
    this.description = description;
    this.strategyId = strategyId;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /**
   * Attaches a rate to this plan. The caller is expected to have run the strategy's
   * {@code validateBillingParameters} on the rate beforehand.
   *
   * @throws RateConflictException if a rate of the same type overlaps the new rate's window
   * @throws CurrencyMismatchException if the rate's currency differs from the plan's
   */
  public void addRate(Rate rate) {
    if (!rates.isEmpty()) {
      String planCurrency = rates.get(0).getCurrency();
      if (!planCurrency.equals(rate.getCurrency())) {
        throw new CurrencyMismatchException(planCurrency, rate.getCurrency());
      }
    }
    for (Rate existing : rates) {
      if (existing.getRateType() == rate.getRateType() && existing.overlaps(rate)) {
        throw new RateConflictException(
            "Rate '"
                + rate.getName()
                + "' overlaps "
                + rate.getRateType()
                + " rate '"
                + existing.getName()
                + "' on plan '"
                + name
                + "'");
      }
    }
    rates.add(rate);
    this.updatedAt = Instant.now();
    domainEvents.add(
        new RateAddedEvent(
            id,
            rate.getName(),
            rate.getRateType().name(),
            rate.getUnitPrice(),
            rate.getCurrency(),
            rate.getEffectiveFrom(),
            rate.getEffectiveTo(),
            Instant.now()));
  }

  /**
   * Prices {@code usage} with this plan's strategy and the rate in force on {@code asOf}.
   *
   * @throws InactivePlanException if the plan has been deactivated
   * @throws MissingRateException if no rate of the strategy's type is attached
   * @throws NoApplicableRateException if no such rate is effective on {@code asOf}
   */
  public PlanCharge calculateCharges(
      UsageData usage, BillingStrategyRegistry registry, LocalDate asOf) {
    if (!active) {
      throw new InactivePlanException(name);
    }
    BillingStrategy strategy = registry.get(strategyId);
    Rate rate = applicableRate(strategy.rateType(), asOf);
    BillingResult result = strategy.calculateCharges(usage, rate);
    return new PlanCharge(strategyId, rate, result);
  }

  /** Returns the rate of {@code rateType} in force on {@code asOf}. */
  public Rate applicableRate(RateType rateType, LocalDate asOf) {
    List<Rate> candidates = rates.stream().filter(r -> r.getRateType() == rateType).toList();
    if (candidates.isEmpty()) {
      throw new MissingRateException(name, rateType);
    }
    return candidates.stream()
        .filter(r -> r.isEffectiveOn(asOf))
        .findFirst()
        .orElseThrow(() -> new NoApplicableRateException(name, rateType, asOf));
  }

  /** Activates the plan. Does nothing if it is already active. */
  public void activate() {
    if (active) {
      return;
    }
    this.active = true;
    this.updatedAt = Instant.now();
    domainEvents.add(new BillingPlanActivatedEvent(id, name, Instant.now()));
  }

  /** Deactivates the plan. Does nothing if it is already inactive. */
  public void deactivate() {
    if (!active) {
      return;
    }
    this.active = false;
    this.updatedAt = Instant.now();
    domainEvents.add(new BillingPlanDeactivatedEvent(id, name, Instant.now()));
  }

  /** The plan currency, taken from its rates; empty until the first rate is added. */
  public Optional<String> currency() {
    return rates.isEmpty() ? Optional.empty() : Optional.of(rates.get(0).getCurrency());
  }

  @DomainEvents
  public Collection<BillingDomainEvent> domainEvents() {
    return List.copyOf(domainEvents);
  }

  @AfterDomainEventPublication
  public void clearDomainEvents() {
    domainEvents.clear();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
    this.updatedAt = Instant.now();
  }

  public String getStrategyId() {
    return strategyId;
  }

  public List<Rate> getRates() {
    return List.copyOf(rates);
  }

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Long getVersion() {
    return version;
  }
}
