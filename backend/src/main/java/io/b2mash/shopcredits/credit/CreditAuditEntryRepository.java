package io.b2mash.shopcredits.credit;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CreditAuditEntryRepository extends JpaRepository<CreditAuditEntry, UUID> {

  boolean existsByRoNumberAndEmployeeAndNote(String roNumber, String employee, String note);

  @Query(
      """
      SELECT e FROM CreditAuditEntry e
      WHERE e.roNumber = :roNumber
      ORDER BY e.entryDate ASC, e.createdAt ASC
      """)
  List<CreditAuditEntry> findByRoNumber(@Param("roNumber") String roNumber);

  @Query(
      """
      SELECT e.employee AS employee, SUM(e.hours) AS hours
      FROM CreditAuditEntry e
      WHERE e.roNumber = :roNumber
      GROUP BY e.employee
      """)
  List<EmployeeHoursTotal> sumHoursByEmployeeForRo(@Param("roNumber") String roNumber);

  /** Credited totals per employee; null bounds are open. */
  @Query(
      """
      SELECT e.employee AS employee, SUM(e.hours) AS hours
      FROM CreditAuditEntry e
      WHERE (:fromDate IS NULL OR e.entryDate >= :fromDate)
        AND (:toDate IS NULL OR e.entryDate <= :toDate)
      GROUP BY e.employee
      """)
  List<EmployeeHoursTotal> sumHoursByEmployee(
      @Param("fromDate") LocalDate fromDate, @Param("toDate") LocalDate toDate);

  @Modifying
  @Query("DELETE FROM CreditAuditEntry e WHERE e.roNumber = :roNumber AND e.note = :note")
  int deleteByRoNumberAndNote(@Param("roNumber") String roNumber, @Param("note") String note);

  /** Removes postings of {@code note} held by anyone other than {@code employee}. */
  @Modifying
  @Query(
      """
      DELETE FROM CreditAuditEntry e
      WHERE e.roNumber = :roNumber AND e.note = :note AND e.employee <> :employee
      """)
  int deleteByRoNumberAndNoteForOtherEmployees(
      @Param("roNumber") String roNumber,
      @Param("note") String note,
      @Param("employee") String employee);
}
