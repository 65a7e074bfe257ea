package io.b2mash.shopcredits.credit;

import io.b2mash.shopcredits.repairorder.RepairOrderRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Appends posted credit lines. {@link #postCreditOnce} is the idempotent variant for call sites
 * that may run repeatedly; {@link #postCredit} always inserts and is meant for one-shot postings
 * such as close-time adjustments.
 */
@Service
public class CreditAuditWriter {

  private static final Logger log = LoggerFactory.getLogger(CreditAuditWriter.class);

  private final CreditAuditEntryRepository creditAuditEntryRepository;
  private final RepairOrderRepository repairOrderRepository;

  public CreditAuditWriter(
      CreditAuditEntryRepository creditAuditEntryRepository,
      RepairOrderRepository repairOrderRepository) {
    this.creditAuditEntryRepository = creditAuditEntryRepository;
    this.repairOrderRepository = repairOrderRepository;
  }

  /** Inserts unconditionally. Returns true when a row was written. */
  @Transactional
  public boolean postCredit(
      String roNumber, String employee, BigDecimal hours, String note, LocalDate date) {
    if (!isPostable(roNumber, employee, hours)) {
      return false;
    }
    insert(roNumber, employee, hours, note, date);
    return true;
  }

  /**
   * Inserts only when no entry exists for the same (RO, employee, note). Returns true when a row
   * was written.
   */
  @Transactional
  public boolean postCreditOnce(
      String roNumber, String employee, BigDecimal hours, String note, LocalDate date) {
    if (!isPostable(roNumber, employee, hours)) {
      return false;
    }
    if (creditAuditEntryRepository.existsByRoNumberAndEmployeeAndNote(
        roNumber, employee.strip(), note)) {
      return false;
    }
    insert(roNumber, employee, hours, note, date);
    return true;
  }

  private boolean isPostable(String roNumber, String employee, BigDecimal hours) {
    if (employee == null || employee.isBlank()) {
      return false;
    }
    if (hours == null || hours.abs().compareTo(CreditLedgerService.LEDGER_EPSILON) < 0) {
      return false;
    }
    // ROs can be deleted while a recompute is in flight
    if (!repairOrderRepository.existsByRoNumber(roNumber)) {
      log.debug("Skipping credit posting for missing RO {}", roNumber);
      return false;
    }
    return true;
  }

  private void insert(
      String roNumber, String employee, BigDecimal hours, String note, LocalDate date) {
    creditAuditEntryRepository.save(
        new CreditAuditEntry(
            date,
            roNumber,
            employee.strip(),
            hours.setScale(CreditLedgerService.HOURS_SCALE, RoundingMode.HALF_UP),
            note));
    log.info("Posted {}h credit to {} on RO {}: {}", hours, employee, roNumber, note);
  }
}
