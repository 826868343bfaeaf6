package io.radbill.billing.outbox;

import io.radbill.billing.event.BillingDomainEvent;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A domain event persisted to {@code billing_outbox_events} in the transaction that produced it.
 * Rows are never updated except for {@code publishedAt}, which a relay sets once it has forwarded
 * the event.
 */
@Entity
@Table(name = "billing_outbox_events")
public class OutboxEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "aggregate_type", nullable = false, length = 50)
  private String aggregateType;

  @Column(name = "aggregate_id", nullable = false)
  private UUID aggregateId;

  @Column(name = "event_type", nullable = false, length = 100)
  private String eventType;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "payload", nullable = false, columnDefinition = "jsonb")
  private Map<String, Object> payload;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  @Column(name = "published_at")
  private Instant publishedAt;

  /** Protected no-arg constructor required by JPA. */
  protected OutboxEvent() {}

  public OutboxEvent(BillingDomainEvent event) {
    this.aggregateType = event.aggregateType();
    this.aggregateId = event.aggregateId();
    this.eventType = event.eventType();
    this.payload = event.details();
    this.occurredAt = event.occurredAt();
  }

  public void markPublished(Instant publishedAt) {
    this.publishedAt = publishedAt;
  }

  public boolean isPublished() {
    return publishedAt != null;
  }

  public UUID getId() {
    return id;
  }

  public String getAggregateType() {
    return aggregateType;
  }

  public UUID getAggregateId() {
    return aggregateId;
  }

  public String getEventType() {
    return eventType;
  }

  public Map<String, Object> getPayload() {
    return payload;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }

  public Instant getPublishedAt() {
    return publishedAt;
  }
}
