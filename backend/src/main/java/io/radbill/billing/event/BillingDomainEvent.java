package io.radbill.billing.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable fact about a state change of a billing aggregate. Aggregates collect these while they
 * are mutated; the repository publishes them when the aggregate is saved, inside the same
 * transaction, and the outbox writer persists each one.
 *
 * <p>Implementations are records holding ids, codes and amounts only, never entity references, so
 * an event stays valid after the transaction that produced it has closed.
 */
public sealed interface BillingDomainEvent permits InvoiceEvent, BillingPlanEvent {

  /** Dotted event name, e.g. {@code invoice.sent}. */
  String eventType();

  String aggregateType();

  UUID aggregateId();

  Instant occurredAt();

  /** Event-specific fields, rendered as the outbox payload. */
  Map<String, Object> details();
}
