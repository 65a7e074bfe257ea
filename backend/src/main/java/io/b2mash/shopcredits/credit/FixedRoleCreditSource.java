package io.b2mash.shopcredits.credit;

import io.b2mash.shopcredits.repairorder.EmployeeRole;
import io.b2mash.shopcredits.repairorder.RepairOrder;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * One named employee per role. Expected credit for a role is its bucket times the shares of every
 * milestone paying that role, i.e. a 100% allocation to the role's assignee.
 */
@Component
@ConditionalOnProperty(
    prefix = "credit",
    name = "source",
    havingValue = "FIXED_ROLE",
    matchIfMissing = true)
public class FixedRoleCreditSource implements CreditSource {

  private final MilestonePolicy milestonePolicy;

  public FixedRoleCreditSource(MilestonePolicy milestonePolicy) {
    this.milestonePolicy = milestonePolicy;
  }

  @Override
  public String responsibleEmployee(RepairOrder repairOrder, EmployeeRole role) {
    return repairOrder.assigneeFor(role);
  }

  @Override
  public Map<String, BigDecimal> expectedCredit(RepairOrder repairOrder) {
    var expected = new LinkedHashMap<String, BigDecimal>();
    for (var role : EmployeeRole.values()) {
      String employee = repairOrder.assigneeFor(role);
      if (employee == null) {
        continue;
      }
      BigDecimal bucket = repairOrder.hoursFor(role.bucket());
      BigDecimal share = milestonePolicy.totalShareFor(role);
      if (bucket.signum() <= 0 || share.signum() <= 0) {
        continue;
      }
      expected.merge(employee, bucket.multiply(share), BigDecimal::add);
    }
    return expected;
  }
}
