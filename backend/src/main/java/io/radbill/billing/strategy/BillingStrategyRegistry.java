package io.radbill.billing.strategy;

import io.radbill.billing.exception.ValidationException;
import io.radbill.billing.rate.RateType;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Looks up billing strategies by id. Built from every {@link BillingStrategy} bean and handed to
 * plans explicitly. At most one strategy may price each rate type.
 */
@Component
public class BillingStrategyRegistry {

  private final Map<String, BillingStrategy> byId = new LinkedHashMap<>();
  private final Set<RateType> pricedRateTypes = EnumSet.noneOf(RateType.class);

  public BillingStrategyRegistry(List<BillingStrategy> strategies) {
    for (BillingStrategy strategy : strategies) {
      if (byId.putIfAbsent(strategy.strategyId(), strategy) != null) {
        throw new IllegalStateException("Duplicate billing strategy id: " + strategy.strategyId());
      }
      if (!pricedRateTypes.add(strategy.rateType())) {
        throw new IllegalStateException(
            "More than one billing strategy prices " + strategy.rateType() + " rates");
      }
    }
  }

  /** Registry holding the four built-in strategies; for code running outside a Spring context. */
  public static BillingStrategyRegistry defaults() {
    return new BillingStrategyRegistry(
        List.of(
            new TimeBillingStrategy(),
            new DataVolumeBillingStrategy(),
            new TieredDataBillingStrategy(),
            new FlatRateBillingStrategy()));
  }

  public BillingStrategy get(String strategyId) {
    var strategy = byId.get(strategyId);
    if (strategy == null) {
      throw new ValidationException(
          "Unknown billing strategy",
          "No billing strategy '" + strategyId + "'; known: " + byId.keySet());
    }
    return strategy;
  }

  public boolean contains(String strategyId) {
    return byId.containsKey(strategyId);
  }

  public Set<String> strategyIds() {
    return byId.keySet();
  }

  public Collection<BillingStrategy> all() {
    return byId.values();
  }
}
