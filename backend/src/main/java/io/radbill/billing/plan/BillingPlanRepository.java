package io.radbill.billing.plan;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BillingPlanRepository extends JpaRepository<BillingPlan, UUID> {

  Optional<BillingPlan> findByName(String name);

  boolean existsByName(String name);

  List<BillingPlan> findByActiveTrueOrderByNameAsc();

  long countByActiveTrue();

  @Query(
      """
      SELECT p FROM BillingPlan p
      WHERE p.id = (SELECT a.planId FROM PlanAssignment a WHERE a.userId = :userId)
      """)
  Optional<BillingPlan> findAssignedToUser(@Param("userId") String userId);
}
