package io.b2mash.shopcredits.credit;

import io.b2mash.shopcredits.exception.ResourceNotFoundException;
import io.b2mash.shopcredits.repairorder.RepairOrderRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Trues up each employee's posted credit on a repair order to the amount the active {@link
 * CreditSource} expects. Always derives the difference from current state, so a second run right
 * after the first posts nothing.
 */
@Service
public class CloseReconciliationService {

  private static final Logger log = LoggerFactory.getLogger(CloseReconciliationService.class);

  static final BigDecimal CLOSE_TOLERANCE = new BigDecimal("0.01");

  private final RepairOrderRepository repairOrderRepository;
  private final CreditAuditEntryRepository creditAuditEntryRepository;
  private final CreditAuditWriter creditAuditWriter;
  private final CreditSource creditSource;

  public CloseReconciliationService(
      RepairOrderRepository repairOrderRepository,
      CreditAuditEntryRepository creditAuditEntryRepository,
      CreditAuditWriter creditAuditWriter,
      CreditSource creditSource) {
    this.repairOrderRepository = repairOrderRepository;
    this.creditAuditEntryRepository = creditAuditEntryRepository;
    this.creditAuditWriter = creditAuditWriter;
    this.creditSource = creditSource;
  }

  @Transactional
  public List<ReconciliationPosting> closeReconcile(String roNumber) {
    var repairOrder =
        repairOrderRepository
            .findByRoNumberForUpdate(roNumber)
            .orElseThrow(() -> ResourceNotFoundException.repairOrder(roNumber));

    Map<String, BigDecimal> expected = creditSource.expectedCredit(repairOrder);
    Map<String, BigDecimal> posted =
        creditAuditEntryRepository.sumHoursByEmployeeForRo(roNumber).stream()
            .collect(
                Collectors.toMap(
                    EmployeeHoursTotal::getEmployee,
                    EmployeeHoursTotal::getHours,
                    BigDecimal::add));

    var employees = new LinkedHashSet<String>(expected.keySet());
    employees.addAll(posted.keySet());

    var postings = new ArrayList<ReconciliationPosting>();
    var today = LocalDate.now();
    for (String employee : employees) {
      var expectedHours = expected.getOrDefault(employee, BigDecimal.ZERO);
      var postedHours = posted.getOrDefault(employee, BigDecimal.ZERO);
      var difference = expectedHours.subtract(postedHours);
      if (difference.abs().compareTo(CLOSE_TOLERANCE) <= 0) {
        continue;
      }
      if (creditAuditWriter.postCredit(
          roNumber, employee, difference, CreditNotes.CLOSE_ADJUSTMENT, today)) {
        postings.add(new ReconciliationPosting(employee, expectedHours, postedHours, difference));
        log.info(
            "Close reconciliation on RO {}: {} expected {}h, posted {}h, adjusted {}h",
            roNumber,
            employee,
            expectedHours,
            postedHours,
            difference);
      }
    }
    if (postings.isEmpty()) {
      log.debug("Close reconciliation on RO {}: nothing to adjust", roNumber);
    }
    return postings;
  }
}
