package io.b2mash.shopcredits.timeclock;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/** Hours each employee actually worked, used as the denominator of efficiency. */
public interface WorkedHoursSource {

  /** Worked hours per employee within the inclusive range; null bounds are open. */
  Map<String, BigDecimal> workedHoursByEmployee(LocalDate from, LocalDate to);
}
