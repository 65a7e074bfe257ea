package io.b2mash.shopcredits.event;

import io.b2mash.shopcredits.repairorder.RepairOrderStatus;
import java.time.Instant;

/** Published once per transition into CLOSED; repeated saves of a closed RO do not publish. */
public record RepairOrderClosedEvent(
    String roNumber, RepairOrderStatus previousStatus, Instant occurredAt)
    implements RepairOrderEvent {

  @Override
  public String eventType() {
    return "repair_order.closed";
  }
}
