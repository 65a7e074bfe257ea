package io.b2mash.shopcredits.repairorder;

import io.b2mash.shopcredits.event.RepairOrderClosedEvent;
import io.b2mash.shopcredits.event.RepairOrderHoursChangedEvent;
import io.b2mash.shopcredits.event.RepairOrderStageChangedEvent;
import io.b2mash.shopcredits.exception.InvalidStateException;
import io.b2mash.shopcredits.exception.ResourceConflictException;
import io.b2mash.shopcredits.exception.ResourceNotFoundException;
import io.b2mash.shopcredits.stagelog.StageTransitionService;
import io.b2mash.shopcredits.workflow.StageOrderingService;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RepairOrderService {

  private static final Logger log = LoggerFactory.getLogger(RepairOrderService.class);

  private static final BigDecimal HUNDRED = new BigDecimal("100");

  private final RepairOrderRepository repairOrderRepository;
  private final HoursAllocationRepository hoursAllocationRepository;
  private final StageOrderingService stageOrderingService;
  private final StageTransitionService stageTransitionService;
  private final ApplicationEventPublisher eventPublisher;

  public RepairOrderService(
      RepairOrderRepository repairOrderRepository,
      HoursAllocationRepository hoursAllocationRepository,
      StageOrderingService stageOrderingService,
      StageTransitionService stageTransitionService,
      ApplicationEventPublisher eventPublisher) {
    this.repairOrderRepository = repairOrderRepository;
    this.hoursAllocationRepository = hoursAllocationRepository;
    this.stageOrderingService = stageOrderingService;
    this.stageTransitionService = stageTransitionService;
    this.eventPublisher = eventPublisher;
  }

  @Transactional
  public RepairOrder createRepairOrder(
      String roNumber,
      LocalDate openedOn,
      BigDecimal totalHours,
      BigDecimal bodyHours,
      BigDecimal refinishHours,
      BigDecimal mechanicalHours,
      String estimator,
      String bodyTechnician,
      String painter,
      String mechanic,
      String stage) {
    String normalizedRo = roNumber.strip();
    if (repairOrderRepository.existsByRoNumber(normalizedRo)) {
      throw ResourceConflictException.duplicateRepairOrder(normalizedRo);
    }
    var ordering = stageOrderingService.current();
    String initialStage = stage == null || stage.isBlank() ? ordering.first() : stage.strip();
    if (initialStage == null || !ordering.contains(initialStage)) {
      throw new InvalidStateException("Unknown stage", "Stage '" + stage + "' is not configured");
    }

    var repairOrder =
        new RepairOrder(
            normalizedRo, openedOn != null ? openedOn : LocalDate.now(), totalHours, initialStage);
    repairOrder.updateHours(
        totalHours, orZero(bodyHours), orZero(refinishHours), orZero(mechanicalHours));
    repairOrder.assign(
        blankToNull(estimator),
        blankToNull(bodyTechnician),
        blankToNull(painter),
        blankToNull(mechanic));
    var saved = repairOrderRepository.save(repairOrder);
    log.info(
        "Created repair order {} at stage {} with {}h", normalizedRo, initialStage, totalHours);
    return saved;
  }

  @Transactional(readOnly = true)
  public RepairOrder getRepairOrder(String roNumber) {
    return repairOrderRepository
        .findByRoNumber(roNumber)
        .orElseThrow(() -> ResourceNotFoundException.repairOrder(roNumber));
  }

  @Transactional(readOnly = true)
  public List<RepairOrder> listRepairOrders(RepairOrderStatus status) {
    return repairOrderRepository.findByStatus(status);
  }

  /** Partial update: null arguments keep the current value, blank assignee names clear it. */
  @Transactional
  public RepairOrder updateRepairOrder(
      String roNumber,
      BigDecimal totalHours,
      BigDecimal bodyHours,
      BigDecimal refinishHours,
      BigDecimal mechanicalHours,
      String estimator,
      String bodyTechnician,
      String painter,
      String mechanic) {
    var repairOrder = lock(roNumber);
    repairOrder.updateHours(
        totalHours != null ? totalHours : repairOrder.getTotalHours(),
        bodyHours != null ? bodyHours : repairOrder.getBodyHours(),
        refinishHours != null ? refinishHours : repairOrder.getRefinishHours(),
        mechanicalHours != null ? mechanicalHours : repairOrder.getMechanicalHours());
    repairOrder.assign(
        estimator != null ? blankToNull(estimator) : repairOrder.getEstimator(),
        bodyTechnician != null ? blankToNull(bodyTechnician) : repairOrder.getBodyTechnician(),
        painter != null ? blankToNull(painter) : repairOrder.getPainter(),
        mechanic != null ? blankToNull(mechanic) : repairOrder.getMechanic());
    var saved = repairOrderRepository.save(repairOrder);
    log.info("Updated hours/assignments on repair order {}", roNumber);
    eventPublisher.publishEvent(new RepairOrderHoursChangedEvent(roNumber, Instant.now()));
    return saved;
  }

  /** Moves the RO to a configured stage, logging the transition. Same-stage moves are no-ops. */
  @Transactional
  public RepairOrder changeStage(String roNumber, String stage) {
    var repairOrder = lock(roNumber);
    if (repairOrder.getStatus() == RepairOrderStatus.CLOSED) {
      throw InvalidStateException.onRepairOrder(
          roNumber,
          "Repair order closed", "Reopen RO " + roNumber + " before changing its stage");
    }
    String target = stage == null ? null : stage.strip();
    if (!stageOrderingService.current().contains(target)) {
      throw new InvalidStateException("Unknown stage", "Stage '" + stage + "' is not configured");
    }
    String from = repairOrder.getCurrentStage();
    if (target.equals(from)) {
      return repairOrder;
    }
    var now = Instant.now();
    stageTransitionService.recordTransition(roNumber, from, target, now);
    repairOrder.moveToStage(target);
    var saved = repairOrderRepository.save(repairOrder);
    eventPublisher.publishEvent(new RepairOrderStageChangedEvent(roNumber, from, target, now));
    return saved;
  }

  @Transactional
  public RepairOrder changeStatus(String roNumber, RepairOrderStatus status) {
    var repairOrder = lock(roNumber);
    var previous = repairOrder.getStatus();
    if (previous == status) {
      return repairOrder;
    }
    repairOrder.changeStatus(status);
    var saved = repairOrderRepository.save(repairOrder);
    log.info("Repair order {} status {} -> {}", roNumber, previous, status);
    if (status == RepairOrderStatus.CLOSED) {
      eventPublisher.publishEvent(new RepairOrderClosedEvent(roNumber, previous, Instant.now()));
    }
    return saved;
  }

  @Transactional(readOnly = true)
  public List<HoursAllocation> listAllocations(String roNumber) {
    getRepairOrder(roNumber);
    return hoursAllocationRepository.findByRoNumber(roNumber);
  }

  /** Replaces the RO's allocation table wholesale. Percentages must lie in [0, 100]. */
  @Transactional
  public List<HoursAllocation> replaceAllocations(String roNumber, List<AllocationInput> inputs) {
    lock(roNumber);
    for (var input : inputs) {
      if (input.employee() == null || input.employee().isBlank()) {
        throw new InvalidStateException("Invalid allocation", "Allocation employee is required");
      }
      if (input.role() == null) {
        throw new InvalidStateException("Invalid allocation", "Allocation role is required");
      }
      if (input.percent() == null
          || input.percent().signum() < 0
          || input.percent().compareTo(HUNDRED) > 0) {
        throw new InvalidStateException(
            "Invalid allocation", "Allocation percent must be between 0 and 100");
      }
    }
    hoursAllocationRepository.deleteByRoNumber(roNumber);
    var saved =
        hoursAllocationRepository.saveAll(
            inputs.stream()
                .map(
                    i ->
                        new HoursAllocation(
                            roNumber, i.employee().strip(), i.role(), i.percent()))
                .toList());
    log.info("Replaced allocations on repair order {} ({} rows)", roNumber, saved.size());
    eventPublisher.publishEvent(new RepairOrderHoursChangedEvent(roNumber, Instant.now()));
    return saved;
  }

  /** Deletes the RO; its transitions, allocations and ledger rows go with it. */
  @Transactional
  public void deleteRepairOrder(String roNumber) {
    var repairOrder = lock(roNumber);
    repairOrderRepository.delete(repairOrder);
    log.info("Deleted repair order {}", roNumber);
  }

  private RepairOrder lock(String roNumber) {
    return repairOrderRepository
        .findByRoNumberForUpdate(roNumber)
        .orElseThrow(() -> ResourceNotFoundException.repairOrder(roNumber));
  }

  private static BigDecimal orZero(BigDecimal value) {
    return value != null ? value : BigDecimal.ZERO;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.strip();
  }

  public record AllocationInput(String employee, EmployeeRole role, BigDecimal percent) {}
}
