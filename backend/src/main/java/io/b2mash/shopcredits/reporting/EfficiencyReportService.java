package io.b2mash.shopcredits.reporting;

import io.b2mash.shopcredits.credit.CreditAuditEntryRepository;
import io.b2mash.shopcredits.credit.EmployeeHoursTotal;
import io.b2mash.shopcredits.exception.InvalidStateException;
import io.b2mash.shopcredits.timeclock.WorkedHoursSource;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Per-employee efficiency over an optional inclusive date range. */
@Service
public class EfficiencyReportService {

  private final WorkedHoursSource workedHoursSource;
  private final CreditAuditEntryRepository creditAuditEntryRepository;

  public EfficiencyReportService(
      WorkedHoursSource workedHoursSource, CreditAuditEntryRepository creditAuditEntryRepository) {
    this.workedHoursSource = workedHoursSource;
    this.creditAuditEntryRepository = creditAuditEntryRepository;
  }

  @Transactional(readOnly = true)
  public List<EmployeeEfficiency> summary(LocalDate from, LocalDate to) {
    if (from != null && to != null && from.isAfter(to)) {
      throw new InvalidStateException("Invalid date range", "from must not be after to");
    }
    Map<String, BigDecimal> worked = workedHoursSource.workedHoursByEmployee(from, to);
    Map<String, BigDecimal> credited =
        creditAuditEntryRepository.sumHoursByEmployee(from, to).stream()
            .collect(
                Collectors.toMap(
                    EmployeeHoursTotal::getEmployee,
                    EmployeeHoursTotal::getHours,
                    BigDecimal::add));

    var employees = new TreeSet<String>(worked.keySet());
    employees.addAll(credited.keySet());

    return employees.stream()
        .map(
            employee -> {
              var workedHours = worked.getOrDefault(employee, BigDecimal.ZERO);
              var creditedHours = credited.getOrDefault(employee, BigDecimal.ZERO);
              var efficiency =
                  workedHours.signum() == 0
                      ? BigDecimal.ZERO.setScale(4)
                      : creditedHours.divide(workedHours, 4, RoundingMode.HALF_UP);
              return new EmployeeEfficiency(employee, workedHours, creditedHours, efficiency);
            })
        .toList();
  }
}
