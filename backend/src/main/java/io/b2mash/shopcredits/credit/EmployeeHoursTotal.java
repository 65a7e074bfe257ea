package io.b2mash.shopcredits.credit;

import java.math.BigDecimal;

/** Projection for per-employee credited hour sums. */
public interface EmployeeHoursTotal {

  String getEmployee();

  BigDecimal getHours();
}
