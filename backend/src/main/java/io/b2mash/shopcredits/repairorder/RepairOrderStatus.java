package io.b2mash.shopcredits.repairorder;

public enum RepairOrderStatus {
  OPEN,
  ON_HOLD,
  CLOSED
}
