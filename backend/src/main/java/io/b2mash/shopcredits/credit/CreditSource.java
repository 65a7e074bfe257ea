package io.b2mash.shopcredits.credit;

import io.b2mash.shopcredits.repairorder.EmployeeRole;
import io.b2mash.shopcredits.repairorder.RepairOrder;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Resolves who is credited on a repair order. Selected by {@code credit.source}; exactly one
 * implementation is active.
 */
public interface CreditSource {

  /** Employee credited for milestones paying {@code role}, or null when nobody is assigned. */
  String responsibleEmployee(RepairOrder repairOrder, EmployeeRole role);

  /** Total credit each employee should hold once the RO is closed, in hours. */
  Map<String, BigDecimal> expectedCredit(RepairOrder repairOrder);
}
