package io.b2mash.shopcredits.timeclock;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TimeClockEntryRepository extends JpaRepository<TimeClockEntry, UUID> {

  /** Worked hours per employee; null bounds are open. */
  @Query(
      """
      SELECT t.employee AS employee, SUM(t.hoursWorked) AS hours
      FROM TimeClockEntry t
      WHERE (:fromDate IS NULL OR t.workDate >= :fromDate)
        AND (:toDate IS NULL OR t.workDate <= :toDate)
      GROUP BY t.employee
      """)
  List<EmployeeWorkedHours> sumHoursByEmployee(
      @Param("fromDate") LocalDate fromDate, @Param("toDate") LocalDate toDate);
}
