package io.radbill.billing.plan;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface PlanAssignmentRepository extends JpaRepository<PlanAssignment, UUID> {

  Optional<PlanAssignment> findByUserId(String userId);

  long countByPlanId(UUID planId);

  @Query("SELECT a.userId FROM PlanAssignment a ORDER BY a.userId")
  List<String> findAllUserIds();
}
