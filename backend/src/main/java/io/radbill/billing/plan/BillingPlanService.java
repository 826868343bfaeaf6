package io.radbill.billing.plan;

import io.radbill.billing.exception.InactivePlanException;
import io.radbill.billing.exception.ResourceConflictException;
import io.radbill.billing.exception.ResourceNotFoundException;
import io.radbill.billing.exception.ValidationException;
import io.radbill.billing.plan.dto.BillingPlanResponse;
import io.radbill.billing.plan.dto.CreateBillingPlanRequest;
import io.radbill.billing.plan.dto.PlanStatistics;
import io.radbill.billing.plan.dto.RateRequest;
import io.radbill.billing.rate.Rate;
import io.radbill.billing.strategy.BillingResult;
import io.radbill.billing.strategy.BillingStrategyRegistry;
import io.radbill.billing.usage.UsageData;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

@Service
@Validated
public class BillingPlanService {

  private static final Logger log = LoggerFactory.getLogger(BillingPlanService.class);

  static final int MIN_NAME_LENGTH = 2;
  static final int MAX_NAME_LENGTH = 128;

  private final BillingPlanRepository billingPlanRepository;
  private final PlanAssignmentRepository planAssignmentRepository;
  private final BillingStrategyRegistry strategyRegistry;
  private final Clock clock;

  public BillingPlanService(
      BillingPlanRepository billingPlanRepository,
      PlanAssignmentRepository planAssignmentRepository,
      BillingStrategyRegistry strategyRegistry,
      Clock clock) {
    this.billingPlanRepository = billingPlanRepository;
    this.planAssignmentRepository = planAssignmentRepository;
    this.strategyRegistry = strategyRegistry;
    this.clock = clock;
  }

  @Transactional
  public BillingPlanResponse createPlan(@Valid CreateBillingPlanRequest request) {
    String name = request.name() != null ? request.name().strip() : "";
    if (name.length() < MIN_NAME_LENGTH || name.length() > MAX_NAME_LENGTH) {
      throw new ValidationException(
          "Invalid plan name",
          "Plan name must be " + MIN_NAME_LENGTH + " to " + MAX_NAME_LENGTH + " characters");
    }
    // fails for unknown strategy ids
    strategyRegistry.get(request.strategyId());
    if (billingPlanRepository.existsByName(name)) {
      throw new ResourceConflictException(
          "Duplicate plan name", "A billing plan named '" + name + "' already exists");
    }
    var plan =
        billingPlanRepository.save(
            new BillingPlan(name, request.description(), request.strategyId()));
    log.info(
        "Created billing plan {} name={} strategy={}", plan.getId(), name, plan.getStrategyId());
    return BillingPlanResponse.from(plan);
  }

  @Transactional
  public BillingPlanResponse addRate(UUID planId, @Valid RateRequest request) {
    return addRate(planId, request.toRate());
  }

  /**
   * Validates {@code rate} with the plan's own strategy, then attaches it to the plan.
   *
   * @throws ValidationException if the rate configuration is unusable or the plan's strategy does
   *     not price rates of its type
   */
  @Transactional
  public BillingPlanResponse addRate(UUID planId, Rate rate) {
    var plan = findPlanEntity(planId);
    strategyRegistry.get(plan.getStrategyId()).validateBillingParameters(rate);
    plan.addRate(rate);
    plan = billingPlanRepository.save(plan);
    log.info(
        "Added {} rate '{}' to plan {} from {}",
        rate.getRateType(),
        rate.getName(),
        planId,
        rate.getEffectiveFrom());
    return BillingPlanResponse.from(plan);
  }

  @Transactional
  public BillingPlanResponse activate(UUID planId) {
    var plan = findPlanEntity(planId);
    plan.activate();
    plan = billingPlanRepository.save(plan);
    log.info("Activated billing plan {}", planId);
    return BillingPlanResponse.from(plan);
  }

  @Transactional
  public BillingPlanResponse deactivate(UUID planId) {
    var plan = findPlanEntity(planId);
    plan.deactivate();
    plan = billingPlanRepository.save(plan);
    log.info("Deactivated billing plan {}", planId);
    return BillingPlanResponse.from(plan);
  }

  @Transactional(readOnly = true)
  public BillingPlanResponse findPlan(UUID planId) {
    return BillingPlanResponse.from(findPlanEntity(planId));
  }

  @Transactional(readOnly = true)
  public List<BillingPlanResponse> listActivePlans() {
    return billingPlanRepository.findByActiveTrueOrderByNameAsc().stream()
        .map(BillingPlanResponse::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public PlanStatistics getStatistics() {
    long total = billingPlanRepository.count();
    long active = billingPlanRepository.countByActiveTrue();
    return new PlanStatistics(total, active, total - active);
  }

  /**
   * Binds a user to a plan, replacing any earlier assignment.
   *
   * @throws InactivePlanException if the plan is deactivated
   */
  @Transactional
  public void assignPlan(String userId, UUID planId) {
    if (userId == null || userId.isBlank()) {
      throw new ValidationException("Invalid user", "User id must not be blank");
    }
    var plan = findPlanEntity(planId);
    if (!plan.isActive()) {
      throw new InactivePlanException(plan.getName());
    }
    var assignment =
        planAssignmentRepository
            .findByUserId(userId)
            .map(
                existing -> {
                  existing.reassign(planId);
                  return existing;
                })
            .orElseGet(() -> new PlanAssignment(userId, planId));
    planAssignmentRepository.save(assignment);
    log.info("Assigned plan {} to user={}", plan.getName(), userId);
  }

  /** Prices {@code usage} with the plan at today's rates without creating an invoice. */
  @Transactional(readOnly = true)
  public BillingResult quote(UUID planId, UsageData usage) {
    var plan = findPlanEntity(planId);
    return plan.calculateCharges(usage, strategyRegistry, LocalDate.now(clock)).result();
  }

  private BillingPlan findPlanEntity(UUID planId) {
    return billingPlanRepository
        .findById(planId)
        .orElseThrow(() -> new ResourceNotFoundException("Billing plan", planId));
  }
}
