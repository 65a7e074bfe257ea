package io.b2mash.shopcredits.reporting;

import io.b2mash.shopcredits.repairorder.EmployeeRole;
import java.math.BigDecimal;

/** Bucket hours assigned to one employee in one role across open repair orders. */
public interface AssignedHoursProjection {

  String getEmployee();

  EmployeeRole getRole();

  BigDecimal getAssignedHours();
}
