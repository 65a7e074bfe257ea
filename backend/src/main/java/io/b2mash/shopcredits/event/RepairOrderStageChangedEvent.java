package io.b2mash.shopcredits.event;

import java.time.Instant;

public record RepairOrderStageChangedEvent(
    String roNumber, String fromStage, String toStage, Instant occurredAt)
    implements RepairOrderEvent {

  @Override
  public String eventType() {
    return "repair_order.stage_changed";
  }
}
