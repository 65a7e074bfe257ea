package io.b2mash.shopcredits.reporting;

import java.math.BigDecimal;

/**
 * Worked vs credited hours for one employee.
 *
 * @param efficiency credited / worked rounded to four places, zero when nothing was worked
 */
public record EmployeeEfficiency(
    String employee, BigDecimal workedHours, BigDecimal creditedHours, BigDecimal efficiency) {}
