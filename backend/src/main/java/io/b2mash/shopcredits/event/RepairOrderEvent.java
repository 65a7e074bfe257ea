package io.b2mash.shopcredits.event;

import java.time.Instant;

/**
 * Base interface for repair order events published via Spring ApplicationEventPublisher.
 * Implementations are records carrying only the RO number and plain values, no JPA entities.
 *
 * <p>Events are consumed synchronously inside the publishing transaction, so the RO mutation and
 * the ledger work it triggers commit or roll back together.
 */
public sealed interface RepairOrderEvent
    permits RepairOrderStageChangedEvent, RepairOrderHoursChangedEvent, RepairOrderClosedEvent {

  String eventType();

  String roNumber();

  Instant occurredAt();
}
