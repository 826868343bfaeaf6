package io.radbill.billing.outbox;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Read and acknowledge side of the outbox, used by whatever relays events onward. */
@Service
public class OutboxService {

  private static final Logger log = LoggerFactory.getLogger(OutboxService.class);

  private final OutboxEventRepository outboxEventRepository;
  private final Clock clock;

  public OutboxService(OutboxEventRepository outboxEventRepository, Clock clock) {
    this.outboxEventRepository = outboxEventRepository;
    this.clock = clock;
  }

  /** Oldest unpublished events first. */
  @Transactional(readOnly = true)
  public List<OutboxEvent> findUnpublished(int limit) {
    return outboxEventRepository.findUnpublished(PageRequest.of(0, limit));
  }

  @Transactional(readOnly = true)
  public List<OutboxEvent> findByAggregate(UUID aggregateId) {
    return outboxEventRepository.findByAggregateIdOrderByOccurredAtAsc(aggregateId);
  }

  /** Marks the given events as published; ids that are unknown or already published are ignored. */
  @Transactional
  public int markPublished(Collection<UUID> eventIds) {
    var now = clock.instant();
    int marked = 0;
    for (OutboxEvent event : outboxEventRepository.findAllById(eventIds)) {
      if (!event.isPublished()) {
        event.markPublished(now);
        marked++;
      }
    }
    log.info("Marked {} outbox events as published", marked);
    return marked;
  }
}
