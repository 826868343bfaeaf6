package io.radbill.billing.outbox;

import io.radbill.billing.event.BillingDomainEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Persists every domain event an aggregate publishes on save. Runs synchronously inside the
 * saving transaction, so an event row exists exactly when the state change it describes commits.
 * A failure here propagates and rolls the state change back.
 */
@Component
public class OutboxEventWriter {

  private static final Logger log = LoggerFactory.getLogger(OutboxEventWriter.class);

  private final OutboxEventRepository outboxEventRepository;

  public OutboxEventWriter(OutboxEventRepository outboxEventRepository) {
    this.outboxEventRepository = outboxEventRepository;
  }

  @EventListener
  public void onDomainEvent(BillingDomainEvent event) {
    outboxEventRepository.save(new OutboxEvent(event));
    log.debug(
        "Outbox event {} for {} {}", event.eventType(), event.aggregateType(), event.aggregateId());
  }
}
