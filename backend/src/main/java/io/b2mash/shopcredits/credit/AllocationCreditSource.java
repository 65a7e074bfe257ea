package io.b2mash.shopcredits.credit;

import io.b2mash.shopcredits.repairorder.EmployeeRole;
import io.b2mash.shopcredits.repairorder.HoursAllocation;
import io.b2mash.shopcredits.repairorder.HoursAllocationRepository;
import io.b2mash.shopcredits.repairorder.RepairOrder;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Percent allocations per employee. Milestone rows go to the role's largest allocation (earliest
 * wins a tie), falling back to the RO's role field; close-time expectation is bucket × percent /
 * 100 per allocation.
 */
@Component
@ConditionalOnProperty(prefix = "credit", name = "source", havingValue = "ALLOCATION")
public class AllocationCreditSource implements CreditSource {

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private final HoursAllocationRepository hoursAllocationRepository;

  public AllocationCreditSource(HoursAllocationRepository hoursAllocationRepository) {
    this.hoursAllocationRepository = hoursAllocationRepository;
  }

  @Override
  public String responsibleEmployee(RepairOrder repairOrder, EmployeeRole role) {
    HoursAllocation best = null;
    for (var allocation : hoursAllocationRepository.findByRoNumber(repairOrder.getRoNumber())) {
      if (allocation.getRole() != role || allocation.getPercent().signum() <= 0) {
        continue;
      }
      if (best == null || allocation.getPercent().compareTo(best.getPercent()) > 0) {
        best = allocation;
      }
    }
    return best != null ? best.getEmployee() : repairOrder.assigneeFor(role);
  }

  @Override
  public Map<String, BigDecimal> expectedCredit(RepairOrder repairOrder) {
    var expected = new LinkedHashMap<String, BigDecimal>();
    for (var allocation : hoursAllocationRepository.findByRoNumber(repairOrder.getRoNumber())) {
      if (allocation.getPercent().signum() <= 0) {
        continue;
      }
      BigDecimal bucket = repairOrder.hoursFor(allocation.getRole().bucket());
      BigDecimal hours =
          bucket
              .multiply(allocation.getPercent())
              .divide(HUNDRED, CreditLedgerService.HOURS_SCALE, RoundingMode.HALF_UP);
      expected.merge(allocation.getEmployee(), hours, BigDecimal::add);
    }
    return expected;
  }
}
