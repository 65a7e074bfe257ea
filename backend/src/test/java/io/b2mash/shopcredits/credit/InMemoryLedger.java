package io.b2mash.shopcredits.credit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

import io.b2mash.shopcredits.repairorder.EmployeeRole;
import io.b2mash.shopcredits.repairorder.HourBucket;
import io.b2mash.shopcredits.repairorder.RepairOrder;
import io.b2mash.shopcredits.repairorder.RepairOrderRepository;
import io.b2mash.shopcredits.stagelog.StageTransition;
import io.b2mash.shopcredits.stagelog.StageTransitionService;
import io.b2mash.shopcredits.workflow.StageOrdering;
import io.b2mash.shopcredits.workflow.StageOrderingService;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.mockito.quality.Strictness;
import org.springframework.test.util.ReflectionTestUtils;

/**
 * Ledger services wired over list-backed repository mocks, so scenario tests can drive the real
 * recompute, override and reconciliation logic without a database.
 */
final class InMemoryLedger {

  static final StageOrdering STAGES =
      StageOrdering.of(
          "Scheduled",
          "Intake",
          "Disassembly",
          "Body",
          "Paint",
          "Reassembly",
          "Mechanical",
          "Detail",
          "QC",
          "Delivered");

  final Map<String, RepairOrder> repairOrders = new HashMap<>();
  final List<StageTransition> transitions = new ArrayList<>();
  final Map<String, CreditBaseline> baselines = new HashMap<>();
  final List<CreditAdjustment> adjustments = new ArrayList<>();
  final List<CreditOverride> overrides = new ArrayList<>();
  final List<CreditAuditEntry> auditEntries = new ArrayList<>();

  final MilestonePolicy policy = new MilestonePolicy(defaultMilestones());
  final CreditLedgerService ledger;
  final CloseReconciliationService reconciliation;
  final CreditAuditWriter writer;

  private final AtomicLong adjustmentIds = new AtomicLong(1);
  private Instant clock = Instant.parse("2025-03-03T08:00:00Z");

  InMemoryLedger() {
    var repairOrderRepository = lenientMock(RepairOrderRepository.class);
    when(repairOrderRepository.findByRoNumber(anyString()))
        .thenAnswer(inv -> Optional.ofNullable(repairOrders.get(inv.<String>getArgument(0))));
    when(repairOrderRepository.findByRoNumberForUpdate(anyString()))
        .thenAnswer(inv -> Optional.ofNullable(repairOrders.get(inv.<String>getArgument(0))));
    when(repairOrderRepository.existsByRoNumber(anyString()))
        .thenAnswer(inv -> repairOrders.containsKey(inv.<String>getArgument(0)));
    when(repairOrderRepository.save(any(RepairOrder.class))).thenAnswer(inv -> inv.getArgument(0));

    var stageOrderingService = lenientMock(StageOrderingService.class);
    when(stageOrderingService.current()).thenReturn(STAGES);

    var stageTransitionService = lenientMock(StageTransitionService.class);
    when(stageTransitionService.transitionsFor(anyString()))
        .thenAnswer(
            inv ->
                transitions.stream()
                    .filter(t -> t.getRoNumber().equals(inv.getArgument(0)))
                    .toList());

    var baselineRepository = lenientMock(CreditBaselineRepository.class);
    when(baselineRepository.findByRoNumberAndMilestoneId(anyString(), anyString()))
        .thenAnswer(
            inv ->
                Optional.ofNullable(
                    baselines.get(baselineKey(inv.getArgument(0), inv.getArgument(1)))));
    when(baselineRepository.insertIfAbsent(anyString(), anyString(), any(BigDecimal.class)))
        .thenAnswer(
            inv -> {
              String key = baselineKey(inv.getArgument(0), inv.getArgument(1));
              if (baselines.containsKey(key)) {
                return 0;
              }
              baselines.put(
                  key,
                  new CreditBaseline(inv.getArgument(0), inv.getArgument(1), inv.getArgument(2)));
              return 1;
            });

    var adjustmentRepository = lenientMock(CreditAdjustmentRepository.class);
    when(adjustmentRepository.save(any(CreditAdjustment.class)))
        .thenAnswer(
            inv -> {
              CreditAdjustment adjustment = inv.getArgument(0);
              ReflectionTestUtils.setField(adjustment, "id", adjustmentIds.getAndIncrement());
              adjustments.add(adjustment);
              return adjustment;
            });
    when(adjustmentRepository.findByRoNumberAndMilestoneId(anyString(), anyString()))
        .thenAnswer(
            inv ->
                adjustments.stream()
                    .filter(
                        a ->
                            a.getRoNumber().equals(inv.getArgument(0))
                                && a.getMilestoneId().equals(inv.getArgument(1)))
                    .toList());
    doAnswer(inv -> adjustments.remove(inv.<CreditAdjustment>getArgument(0)))
        .when(adjustmentRepository)
        .delete(any(CreditAdjustment.class));

    var overrideRepository = lenientMock(CreditOverrideRepository.class);
    when(overrideRepository.findByRoNumber(anyString()))
        .thenAnswer(
            inv ->
                overrides.stream()
                    .filter(o -> o.getRoNumber().equals(inv.getArgument(0)))
                    .toList());
    when(overrideRepository.findByKey(anyString(), anyString(), anyString(), anyString()))
        .thenAnswer(
            inv -> {
              var key =
                  new CreditRowKey(
                      inv.getArgument(0),
                      inv.getArgument(1),
                      inv.getArgument(2),
                      inv.getArgument(3));
              return overrides.stream().filter(o -> o.key().equals(key)).findFirst();
            });
    when(overrideRepository.save(any(CreditOverride.class)))
        .thenAnswer(
            inv -> {
              CreditOverride override = inv.getArgument(0);
              if (overrides.stream().noneMatch(o -> o == override)) {
                overrides.add(override);
              }
              return override;
            });
    doAnswer(inv -> overrides.remove(inv.<CreditOverride>getArgument(0)))
        .when(overrideRepository)
        .delete(any(CreditOverride.class));

    var auditRepository = lenientMock(CreditAuditEntryRepository.class);
    when(auditRepository.existsByRoNumberAndEmployeeAndNote(anyString(), anyString(), anyString()))
        .thenAnswer(
            inv ->
                auditEntries.stream()
                    .anyMatch(
                        e ->
                            e.getRoNumber().equals(inv.getArgument(0))
                                && e.getEmployee().equals(inv.getArgument(1))
                                && e.getNote().equals(inv.getArgument(2))));
    when(auditRepository.save(any(CreditAuditEntry.class)))
        .thenAnswer(
            inv -> {
              auditEntries.add(inv.getArgument(0));
              return inv.getArgument(0);
            });
    when(auditRepository.findByRoNumber(anyString()))
        .thenAnswer(
            inv ->
                auditEntries.stream()
                    .filter(e -> e.getRoNumber().equals(inv.getArgument(0)))
                    .toList());
    when(auditRepository.sumHoursByEmployeeForRo(anyString()))
        .thenAnswer(
            inv ->
                auditEntries.stream()
                    .filter(e -> e.getRoNumber().equals(inv.getArgument(0)))
                    .collect(
                        Collectors.groupingBy(
                            CreditAuditEntry::getEmployee,
                            Collectors.reducing(
                                BigDecimal.ZERO, CreditAuditEntry::getHours, BigDecimal::add)))
                    .entrySet()
                    .stream()
                    .map(e -> (EmployeeHoursTotal) new Total(e.getKey(), e.getValue()))
                    .toList());
    when(auditRepository.deleteByRoNumberAndNote(anyString(), anyString()))
        .thenAnswer(
            inv -> {
              int before = auditEntries.size();
              auditEntries.removeIf(
                  e ->
                      e.getRoNumber().equals(inv.getArgument(0))
                          && e.getNote().equals(inv.getArgument(1)));
              return before - auditEntries.size();
            });

    when(auditRepository.deleteByRoNumberAndNoteForOtherEmployees(
            anyString(), anyString(), anyString()))
        .thenAnswer(
            inv -> {
              int before = auditEntries.size();
              auditEntries.removeIf(
                  e ->
                      e.getRoNumber().equals(inv.getArgument(0))
                          && e.getNote().equals(inv.getArgument(1))
                          && !e.getEmployee().equals(inv.getArgument(2)));
              return before - auditEntries.size();
            });

    var creditSource = new FixedRoleCreditSource(policy);
    writer = new CreditAuditWriter(auditRepository, repairOrderRepository);
    ledger =
        new CreditLedgerService(
            repairOrderRepository,
            stageOrderingService,
            stageTransitionService,
            policy,
            baselineRepository,
            adjustmentRepository,
            new CreditOverrideService(overrideRepository),
            writer,
            auditRepository,
            creditSource);
    reconciliation =
        new CloseReconciliationService(
            repairOrderRepository, auditRepository, writer, creditSource);
  }

  static List<Milestone> defaultMilestones() {
    return List.of(
        new Milestone(
            "body_60",
            "Body 60%",
            "Body",
            TargetMatch.AT_OR_AFTER,
            "Paint",
            HourBucket.BODY,
            EmployeeRole.BODY_TECHNICIAN,
            new BigDecimal("0.60")),
        new Milestone(
            "body_40",
            "Body 40%",
            "Reassembly",
            TargetMatch.STRICTLY_AFTER,
            "Reassembly",
            HourBucket.BODY,
            EmployeeRole.BODY_TECHNICIAN,
            new BigDecimal("0.40")),
        new Milestone(
            "paint_100",
            "Refinish 100%",
            "Paint",
            TargetMatch.STRICTLY_AFTER,
            "Paint",
            HourBucket.REFINISH,
            EmployeeRole.PAINTER,
            new BigDecimal("1.00")),
        new Milestone(
            "mech_100",
            "Mechanical 100%",
            "Mechanical",
            TargetMatch.STRICTLY_AFTER,
            "Mechanical",
            HourBucket.MECHANICAL,
            EmployeeRole.MECHANIC,
            new BigDecimal("1.00")));
  }

  RepairOrder repairOrder(
      String roNumber, String total, String body, String refinish, String mech) {
    var ro = new RepairOrder(roNumber, LocalDate.of(2025, 3, 1), new BigDecimal(total), "Body");
    ro.updateHours(
        new BigDecimal(total),
        new BigDecimal(body),
        new BigDecimal(refinish),
        new BigDecimal(mech));
    ro.assign("Erin", "Alice", "Paula", "Mike");
    repairOrders.put(roNumber, ro);
    return ro;
  }

  void transition(String roNumber, String from, String to) {
    clock = clock.plus(1, ChronoUnit.HOURS);
    transitions.add(new StageTransition(roNumber, from, to, clock));
    repairOrders.get(roNumber).moveToStage(to);
  }

  void setBodyHours(String roNumber, String body) {
    var ro = repairOrders.get(roNumber);
    ro.updateHours(
        ro.getTotalHours(), new BigDecimal(body), ro.getRefinishHours(), ro.getMechanicalHours());
  }

  BigDecimal postedTo(String roNumber, String employee) {
    return auditEntries.stream()
        .filter(e -> e.getRoNumber().equals(roNumber) && e.getEmployee().equals(employee))
        .map(CreditAuditEntry::getHours)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  List<CreditAdjustment> adjustmentsFor(String roNumber, String milestoneId) {
    return adjustments.stream()
        .filter(a -> a.getRoNumber().equals(roNumber) && a.getMilestoneId().equals(milestoneId))
        .toList();
  }

  private static String baselineKey(String roNumber, String milestoneId) {
    return roNumber + "|" + milestoneId;
  }

  private static <T> T lenientMock(Class<T> type) {
    return mock(type, withSettings().strictness(Strictness.LENIENT));
  }

  private record Total(String employee, BigDecimal hours) implements EmployeeHoursTotal {

    @Override
    public String getEmployee() {
      return employee;
    }

    @Override
    public BigDecimal getHours() {
      return hours;
    }
  }
}
