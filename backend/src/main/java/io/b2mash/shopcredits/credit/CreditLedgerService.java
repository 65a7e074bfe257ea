package io.b2mash.shopcredits.credit;

import io.b2mash.shopcredits.exception.InvalidStateException;
import io.b2mash.shopcredits.exception.ResourceNotFoundException;
import io.b2mash.shopcredits.repairorder.HourBucket;
import io.b2mash.shopcredits.repairorder.RepairOrder;
import io.b2mash.shopcredits.repairorder.RepairOrderRepository;
import io.b2mash.shopcredits.stagelog.StageTransition;
import io.b2mash.shopcredits.stagelog.StageTransitionService;
import io.b2mash.shopcredits.workflow.StageOrdering;
import io.b2mash.shopcredits.workflow.StageOrderingService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Production credit ledger for repair orders.
 *
 * <p>Each reached milestone owns a frozen baseline (the bucket value when it was first reached)
 * plus an append-only list of adjustments. A recompute appends whatever residual separates the
 * ledger from the current bucket value, renders one credit row per baseline and adjustment,
 * applies overrides and posts the rows to the audit log. Every mutating entry point locks the
 * repair order row first.
 */
@Service
public class CreditLedgerService {

  private static final Logger log = LoggerFactory.getLogger(CreditLedgerService.class);

  /** Residuals smaller than this are treated as zero. */
  public static final BigDecimal LEDGER_EPSILON = new BigDecimal("0.000001");

  public static final int HOURS_SCALE = 6;

  private static final BigDecimal DELTA_MATCH_TOLERANCE = new BigDecimal("0.00001");

  private final RepairOrderRepository repairOrderRepository;
  private final StageOrderingService stageOrderingService;
  private final StageTransitionService stageTransitionService;
  private final MilestonePolicy milestonePolicy;
  private final CreditBaselineRepository creditBaselineRepository;
  private final CreditAdjustmentRepository creditAdjustmentRepository;
  private final CreditOverrideService creditOverrideService;
  private final CreditAuditWriter creditAuditWriter;
  private final CreditAuditEntryRepository creditAuditEntryRepository;
  private final CreditSource creditSource;

  public CreditLedgerService(
      RepairOrderRepository repairOrderRepository,
      StageOrderingService stageOrderingService,
      StageTransitionService stageTransitionService,
      MilestonePolicy milestonePolicy,
      CreditBaselineRepository creditBaselineRepository,
      CreditAdjustmentRepository creditAdjustmentRepository,
      CreditOverrideService creditOverrideService,
      CreditAuditWriter creditAuditWriter,
      CreditAuditEntryRepository creditAuditEntryRepository,
      CreditSource creditSource) {
    this.repairOrderRepository = repairOrderRepository;
    this.stageOrderingService = stageOrderingService;
    this.stageTransitionService = stageTransitionService;
    this.milestonePolicy = milestonePolicy;
    this.creditBaselineRepository = creditBaselineRepository;
    this.creditAdjustmentRepository = creditAdjustmentRepository;
    this.creditOverrideService = creditOverrideService;
    this.creditAuditWriter = creditAuditWriter;
    this.creditAuditEntryRepository = creditAuditEntryRepository;
    this.creditSource = creditSource;
  }

  /**
   * Brings the ledger in line with the repair order's current hours and stage history, posts the
   * resulting rows and writes the taken/remaining totals back. Safe to call any number of times.
   */
  @Transactional
  public List<CreditRow> recompute(String roNumber) {
    return recomputeLocked(lockRepairOrder(roNumber));
  }

  /** Renders the current credit rows, overrides included, without touching the ledger. */
  @Transactional(readOnly = true)
  public List<CreditRow> generatedCreditRows(String roNumber) {
    var repairOrder =
        repairOrderRepository
            .findByRoNumber(roNumber)
            .orElseThrow(() -> ResourceNotFoundException.repairOrder(roNumber));
    return creditOverrideService.applyOverrides(roNumber, ledgerRows(repairOrder, false));
  }

  @Transactional(readOnly = true)
  public List<CreditAuditEntry> auditEntries(String roNumber) {
    if (!repairOrderRepository.existsByRoNumber(roNumber)) {
      throw ResourceNotFoundException.repairOrder(roNumber);
    }
    return creditAuditEntryRepository.findByRoNumber(roNumber);
  }

  /**
   * Pins the date, tech and/or hours of a generated row. Null or blank values keep the generated
   * value. The row's earlier postings are withdrawn so the recompute re-posts the overridden
   * values.
   */
  @Transactional
  public List<CreditRow> setOverride(
      CreditRowKey key, LocalDate date, String tech, BigDecimal hours) {
    var repairOrder = lockRepairOrder(key.roNumber());
    var matching =
        ledgerRows(repairOrder, false).stream().filter(row -> row.key().equals(key)).toList();
    if (matching.isEmpty()) {
      throw ResourceNotFoundException.onRepairOrder(
          key.roNumber(),
          "Credit row not found",
          "No credit row on RO " + key.roNumber() + " with note '" + key.note() + "'");
    }
    withdrawPostings(key.roNumber(), matching);
    creditOverrideService.upsert(key, date, tech, hours);
    return recomputeLocked(repairOrder);
  }

  @Transactional
  public List<CreditRow> deleteOverride(CreditRowKey key) {
    var repairOrder = lockRepairOrder(key.roNumber());
    if (!creditOverrideService.delete(key)) {
      throw ResourceNotFoundException.onRepairOrder(
          key.roNumber(),
          "Credit override not found",
          "No override on RO " + key.roNumber() + " for note '" + key.note() + "'");
    }
    withdrawPostings(
        key.roNumber(),
        ledgerRows(repairOrder, false).stream().filter(row -> row.key().equals(key)).toList());
    return recomputeLocked(repairOrder);
  }

  /**
   * Removes the adjustment behind a displayed supplement row, or failing that the override on the
   * row's key. The recompute that follows re-captures any remaining residual as a fresh adjustment
   * dated today and attributed to the currently responsible employee.
   */
  @Transactional
  public List<CreditRow> deleteSupplement(String roNumber, DisplayedRow row) {
    var repairOrder = lockRepairOrder(roNumber);
    if (milestonePolicy.isBaselineNote(row.note())) {
      throw InvalidStateException.onRepairOrder(
          roNumber,
          "Baseline row", "Baseline credit rows cannot be deleted; override them instead");
    }

    var parsed = CreditNotes.parseSupplement(row.note());
    var milestone = parsed.flatMap(p -> milestonePolicy.findByLabel(p.milestoneLabel()));
    if (parsed.isPresent() && milestone.isPresent() && row.hours() != null) {
      int sign = parsed.get().sign();
      for (var adjustment :
          creditAdjustmentRepository.findByRoNumberAndMilestoneId(
              roNumber, milestone.get().id())) {
        if (isDisplayedAs(adjustment, row, sign)) {
          String postingNote =
              CreditNotes.supplementPosting(
                  CreditNotes.supplement(milestone.get(), adjustment.getDeltaHours()),
                  adjustment.getId());
          creditAuditEntryRepository.deleteByRoNumberAndNote(roNumber, postingNote);
          creditAdjustmentRepository.delete(adjustment);
          log.info(
              "Deleted credit adjustment {} ({}h) for milestone {} on RO {}",
              adjustment.getId(),
              adjustment.getDeltaHours(),
              adjustment.getMilestoneId(),
              roNumber);
          return recomputeLocked(repairOrder);
        }
      }
    }

    var key = new CreditRowKey(roNumber, row.fromStage(), row.toStage(), row.note());
    if (creditOverrideService.delete(key)) {
      withdrawPostings(
          roNumber,
          ledgerRows(repairOrder, false).stream().filter(r -> r.key().equals(key)).toList());
      return recomputeLocked(repairOrder);
    }
    throw ResourceNotFoundException.onRepairOrder(
        roNumber,
        "Supplement not found",
        "No supplement or override on RO " + roNumber + " matches '" + row.note() + "'");
  }

  private RepairOrder lockRepairOrder(String roNumber) {
    return repairOrderRepository
        .findByRoNumberForUpdate(roNumber)
        .orElseThrow(() -> ResourceNotFoundException.repairOrder(roNumber));
  }

  private List<CreditRow> recomputeLocked(RepairOrder repairOrder) {
    String roNumber = repairOrder.getRoNumber();
    var rows = creditOverrideService.applyOverrides(roNumber, ledgerRows(repairOrder, true));

    var taken = BigDecimal.ZERO;
    for (var row : rows) {
      reattributePostings(roNumber, row);
      creditAuditWriter.postCreditOnce(
          roNumber, row.employee(), row.hours(), row.postingNote(), row.date());
      if (row.hours() != null) {
        taken = taken.add(row.hours());
      }
    }
    var remaining = repairOrder.hoursFor(HourBucket.TOTAL).subtract(taken);
    repairOrder.recordCreditTotals(
        taken.setScale(HOURS_SCALE, RoundingMode.HALF_UP),
        remaining.signum() < 0
            ? BigDecimal.ZERO.setScale(HOURS_SCALE)
            : remaining.setScale(HOURS_SCALE, RoundingMode.HALF_UP));
    repairOrderRepository.save(repairOrder);
    log.debug("Recomputed {} credit rows for RO {}", rows.size(), roNumber);
    return rows;
  }

  /**
   * Baseline and supplement rows for every reached milestone. With {@code capture} set, missing
   * baselines are frozen and residuals are appended as adjustments; otherwise only stored ledger
   * state is rendered.
   */
  private List<CreditRow> ledgerRows(RepairOrder repairOrder, boolean capture) {
    String roNumber = repairOrder.getRoNumber();
    StageOrdering ordering = stageOrderingService.current();
    List<StageTransition> transitions = stageTransitionService.transitionsFor(roNumber);

    var rows = new ArrayList<CreditRow>();
    for (var milestone : milestonePolicy.milestones()) {
      var reached = milestone.firstMatchIn(transitions, ordering);
      if (reached.isEmpty()) {
        continue;
      }
      var transition = reached.get();
      var current = repairOrder.hoursFor(milestone.bucket());
      String responsible = creditSource.responsibleEmployee(repairOrder, milestone.role());

      var baseline =
          creditBaselineRepository.findByRoNumberAndMilestoneId(roNumber, milestone.id());
      if (baseline.isEmpty()) {
        if (!capture || current.signum() <= 0) {
          continue;
        }
        if (creditBaselineRepository.insertIfAbsent(roNumber, milestone.id(), current) > 0) {
          log.info(
              "Froze {} baseline at {}h for RO {}", milestone.label(), current, roNumber);
        }
        baseline = creditBaselineRepository.findByRoNumberAndMilestoneId(roNumber, milestone.id());
        if (baseline.isEmpty()) {
          throw new IllegalStateException(
              "Baseline for " + milestone.id() + " on RO " + roNumber + " vanished after insert");
        }
      }
      var base = baseline.get().getBaseHours();

      var adjustments =
          new ArrayList<>(
              creditAdjustmentRepository.findByRoNumberAndMilestoneId(roNumber, milestone.id()));
      if (capture) {
        var applied =
            adjustments.stream()
                .map(CreditAdjustment::getDeltaHours)
                .reduce(base, BigDecimal::add);
        var unapplied = current.subtract(applied);
        if (unapplied.abs().compareTo(LEDGER_EPSILON) >= 0) {
          var adjustment =
              creditAdjustmentRepository.save(
                  new CreditAdjustment(
                      roNumber,
                      milestone.id(),
                      unapplied.setScale(HOURS_SCALE, RoundingMode.HALF_UP),
                      transition.getFromStage(),
                      transition.getToStage(),
                      LocalDate.now(),
                      responsible,
                      milestone.share()));
          adjustments.add(adjustment);
          log.info(
              "Appended {}h {} adjustment for RO {} (tech {})",
              adjustment.getDeltaHours(),
              milestone.label(),
              roNumber,
              responsible);
        }
      }

      rows.add(
          new CreditRow(
              transition.occurredOn(),
              roNumber,
              transition.getFromStage(),
              transition.getToStage(),
              responsible,
              credit(base, milestone.share()),
              CreditNotes.baseline(
                  milestone, base, transition.getFromStage(), transition.getToStage()),
              CreditRowOrigin.BASELINE,
              milestone.id(),
              null,
              false));
      for (var adjustment : adjustments) {
        rows.add(
            new CreditRow(
                adjustment.getAdjustmentDate(),
                roNumber,
                adjustment.getFromStage(),
                adjustment.getToStage(),
                adjustment.getTech() != null ? adjustment.getTech() : responsible,
                credit(adjustment.getDeltaHours(), adjustment.getShare()),
                CreditNotes.supplement(milestone, adjustment.getDeltaHours()),
                CreditRowOrigin.SUPPLEMENT,
                milestone.id(),
                adjustment.getId(),
                false));
      }
    }
    return rows;
  }

  /** A row moves with its employee, so postings of the same note by anyone else are stale. */
  private void reattributePostings(String roNumber, CreditRow row) {
    if (row.employee() == null || row.employee().isBlank()) {
      return;
    }
    int removed =
        creditAuditEntryRepository.deleteByRoNumberAndNoteForOtherEmployees(
            roNumber, row.postingNote(), row.employee().strip());
    if (removed > 0) {
      log.info(
          "Moved posting '{}' on RO {} to {} ({} stale entries withdrawn)",
          row.postingNote(),
          roNumber,
          row.employee(),
          removed);
    }
  }

  private void withdrawPostings(String roNumber, List<CreditRow> rows) {
    rows.stream()
        .map(CreditRow::postingNote)
        .distinct()
        .forEach(
            note -> {
              int removed = creditAuditEntryRepository.deleteByRoNumberAndNote(roNumber, note);
              if (removed > 0) {
                log.info("Withdrew {} postings '{}' on RO {}", removed, note, roNumber);
              }
            });
  }

  private static boolean isDisplayedAs(CreditAdjustment adjustment, DisplayedRow row, int sign) {
    if (!Objects.equals(adjustment.getFromStage(), row.fromStage())
        || !Objects.equals(adjustment.getToStage(), row.toStage())
        || !Objects.equals(adjustment.getAdjustmentDate(), row.date())) {
      return false;
    }
    if (adjustment.getTech() != null
        && (row.employee() == null || !adjustment.getTech().equals(row.employee().strip()))) {
      return false;
    }
    var displayedDelta =
        row.hours()
            .abs()
            .divide(adjustment.getShare(), HOURS_SCALE + 2, RoundingMode.HALF_UP)
            .multiply(BigDecimal.valueOf(sign));
    var mismatch = adjustment.getDeltaHours().subtract(displayedDelta).abs();
    return mismatch.compareTo(DELTA_MATCH_TOLERANCE) < 0;
  }

  private static BigDecimal credit(BigDecimal hours, BigDecimal share) {
    return hours.multiply(share).setScale(HOURS_SCALE, RoundingMode.HALF_UP);
  }

  /** A credit row as shown to the operator, used to locate the supplement behind it. */
  public record DisplayedRow(
      String fromStage,
      String toStage,
      LocalDate date,
      String employee,
      BigDecimal hours,
      String note) {}
}
