package io.b2mash.shopcredits.reporting;

import io.b2mash.shopcredits.repairorder.EmployeeRole;
import java.math.BigDecimal;
import java.util.List;

/** Shop-floor workload: open repair orders per stage and assigned hours per employee and role. */
public record Dashboard(List<StageCount> openByStage, List<AssignedHours> assignedHours) {

  public record StageCount(String stage, long openRepairOrders) {}

  public record AssignedHours(String employee, EmployeeRole role, BigDecimal hours) {}
}
