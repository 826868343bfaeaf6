package io.radbill.billing.outbox;

import io.radbill.billing.event.BillingDomainEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/** Logs billing events once their transaction has committed. */
@Component
public class BillingEventLogger {

  private static final Logger log = LoggerFactory.getLogger(BillingEventLogger.class);

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onCommitted(BillingDomainEvent event) {
    log.info(
        "Committed {} {}={} details={}",
        event.eventType(),
        event.aggregateType(),
        event.aggregateId(),
        event.details());
  }
}
