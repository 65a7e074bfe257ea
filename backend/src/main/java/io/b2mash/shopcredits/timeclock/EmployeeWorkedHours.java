package io.b2mash.shopcredits.timeclock;

import java.math.BigDecimal;

public interface EmployeeWorkedHours {
  String getEmployee();

  BigDecimal getHours();
}
