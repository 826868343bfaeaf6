package io.radbill.billing.outbox;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OutboxEventRepository extends JpaRepository<OutboxEvent, UUID> {

  List<OutboxEvent> findByAggregateIdOrderByOccurredAtAsc(UUID aggregateId);

  @Query("SELECT e FROM OutboxEvent e WHERE e.publishedAt IS NULL ORDER BY e.occurredAt ASC")
  List<OutboxEvent> findUnpublished(Pageable pageable);

  long countByPublishedAtIsNull();

  @Query(
      """
      SELECT e.eventType FROM OutboxEvent e
      WHERE e.aggregateId = :aggregateId
      ORDER BY e.occurredAt ASC
      """)
  List<String> findEventTypes(@Param("aggregateId") UUID aggregateId);
}
