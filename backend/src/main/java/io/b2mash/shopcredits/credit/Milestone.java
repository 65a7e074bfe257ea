package io.b2mash.shopcredits.credit;

import io.b2mash.shopcredits.repairorder.EmployeeRole;
import io.b2mash.shopcredits.repairorder.HourBucket;
import io.b2mash.shopcredits.stagelog.StageTransition;
import io.b2mash.shopcredits.workflow.StageOrdering;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * A credit-triggering rule: leaving {@code fromStage} for a stage that satisfies {@code match}
 * against {@code targetStage} pays {@code share} of {@code bucket} to the employee holding {@code
 * role}.
 */
public record Milestone(
    String id,
    String label,
    String fromStage,
    TargetMatch match,
    String targetStage,
    HourBucket bucket,
    EmployeeRole role,
    BigDecimal share) {

  public boolean matches(StageTransition transition, StageOrdering ordering) {
    return fromStage.equals(transition.getFromStage())
        && match.test(ordering, transition.getToStage(), targetStage);
  }

  /**
   * Returns the first transition, in log order, that reaches this milestone. The list must already
   * be in log order.
   */
  public Optional<StageTransition> firstMatchIn(
      List<StageTransition> transitions, StageOrdering ordering) {
    for (var transition : transitions) {
      if (matches(transition, ordering)) {
        return Optional.of(transition);
      }
    }
    return Optional.empty();
  }
}
