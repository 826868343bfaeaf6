package io.radbill.billing.plan;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Binds a RADIUS user to the billing plan their invoices are generated with. */
@Entity
@Table(name = "plan_assignments")
public class PlanAssignment {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, unique = true, length = 128)
  private String userId;

  @Column(name = "plan_id", nullable = false)
  private UUID planId;

  @Column(name = "assigned_at", nullable = false)
  private Instant assignedAt;

  protected PlanAssignment() {}

  public PlanAssignment(String userId, UUID planId) {
    this.userId = userId;
    this.planId = planId;
    this.assignedAt = Instant.now();
  }

  /** Moves the user to another plan. */
  public void reassign(UUID planId) {
    this.planId = planId;
    this.assignedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getUserId() {
    return userId;
  }

  public UUID getPlanId() {
    return planId;
  }

  public Instant getAssignedAt() {
    return assignedAt;
  }
}
