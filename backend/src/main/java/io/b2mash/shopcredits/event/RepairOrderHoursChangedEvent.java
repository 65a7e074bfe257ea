package io.b2mash.shopcredits.event;

import java.time.Instant;

public record RepairOrderHoursChangedEvent(String roNumber, Instant occurredAt)
    implements RepairOrderEvent {

  @Override
  public String eventType() {
    return "repair_order.hours_changed";
  }
}
