package io.radbill.billing.rate;

import io.radbill.billing.money.Money;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A priced unit with an effective window, owned by a billing plan. Rates have no mutators: once
 * created they never change, so every invoice item that references one stays explainable. To
 * change pricing, add a new rate whose window starts after the old one ends.
 *
 * <p>The window is inclusive on both ends; a null {@code effectiveTo} means open-ended.
 */
@Entity
@Table(name = "rates")
public class Rate {

  static final LocalDate FAR_FUTURE = LocalDate.of(9999, 12, 31);

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 128)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "rate_type", nullable = false, length = 20)
  private RateType rateType;

  @Column(name = "unit_price", nullable = false, precision = 19, scale = 6)
  private BigDecimal unitPrice;

  @Column(name = "unit_size")
  private Long unitSize;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "rate_tiers", joinColumns = @JoinColumn(name = "rate_id"))
  @OrderColumn(name = "tier_index")
  private List<RateTier> tiers = new ArrayList<>();

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "effective_from", nullable = false)
  private LocalDate effectiveFrom;

  @Column(name = "effective_to")
  private LocalDate effectiveTo;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Rate() {}

  private Rate(
      String name,
      RateType rateType,
      BigDecimal unitPrice,
      Long unitSize,
      List<RateTier> tiers,
      String currency,
      LocalDate effectiveFrom,
      LocalDate effectiveTo) {
    this.name = Objects.requireNonNull(name, "name must not be null");
    this.rateType = Objects.requireNonNull(rateType, "rateType must not be null");
    this.unitPrice = Objects.requireNonNull(unitPrice, "unitPrice must not be null");
    this.unitSize = unitSize;
    this.tiers = new ArrayList<>(tiers);
    this.currency = Money.zero(currency).currency();
    this.effectiveFrom = Objects.requireNonNull(effectiveFrom, "effectiveFrom must not be null");
    this.effectiveTo = effectiveTo;
    this.createdAt = Instant.now();
  }

  public static Rate hourly(
      String name,
      BigDecimal hourlyRate,
      String currency,
      LocalDate effectiveFrom,
      LocalDate effectiveTo) {
    return new Rate(
        name, RateType.HOURLY, hourlyRate, null, List.of(), currency, effectiveFrom, effectiveTo);
  }

  public static Rate perUnit(
      String name,
      BigDecimal unitPrice,
      long unitSize,
      String currency,
      LocalDate effectiveFrom,
      LocalDate effectiveTo) {
    return new Rate(
        name,
        RateType.PER_UNIT,
        unitPrice,
        unitSize,
        List.of(),
        currency,
        effectiveFrom,
        effectiveTo);
  }

  /**
   * Creates a tiered rate. The headline {@code unitPrice} is the last tier's price, which is what
   * usage beyond the final bracket is billed at.
   */
  public static Rate tiered(
      String name,
      List<RateTier> tiers,
      long unitSize,
      String currency,
      LocalDate effectiveFrom,
      LocalDate effectiveTo) {
    BigDecimal headline =
        tiers.isEmpty() ? BigDecimal.ZERO : tiers.get(tiers.size() - 1).unitPrice();
    return new Rate(
        name, RateType.TIERED, headline, unitSize, tiers, currency, effectiveFrom, effectiveTo);
  }

  public static Rate flat(
      String name,
      BigDecimal periodFee,
      String currency,
      LocalDate effectiveFrom,
      LocalDate effectiveTo) {
    return new Rate(
        name, RateType.FLAT, periodFee, null, List.of(), currency, effectiveFrom, effectiveTo);
  }

  /** Returns true if {@code date} falls inside this rate's window. */
  public boolean isEffectiveOn(LocalDate date) {
    return !effectiveFrom.isAfter(date) && !windowEnd().isBefore(date);
  }

  /** Returns true if the two windows share at least one day. */
  public boolean overlaps(Rate other) {
    return !effectiveFrom.isAfter(other.windowEnd()) && !other.effectiveFrom.isAfter(windowEnd());
  }

  /** Tiers in ascending {@code usageLimit} order. */
  public List<RateTier> sortedTiers() {
    return tiers.stream().sorted(Comparator.comparingLong(RateTier::usageLimit)).toList();
  }

  public Money unitPriceMoney() {
    return Money.of(unitPrice, currency);
  }

  private LocalDate windowEnd() {
    return effectiveTo != null ? effectiveTo : FAR_FUTURE;
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public RateType getRateType() {
    return rateType;
  }

  public BigDecimal getUnitPrice() {
    return unitPrice;
  }

  public Long getUnitSize() {
    return unitSize;
  }

  public List<RateTier> getTiers() {
    return List.copyOf(tiers);
  }

  public String getCurrency() {
    return currency;
  }

  public LocalDate getEffectiveFrom() {
    return effectiveFrom;
  }

  public LocalDate getEffectiveTo() {
    return effectiveTo;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
