package io.b2mash.shopcredits.credit;

import io.b2mash.shopcredits.repairorder.EmployeeRole;
import io.b2mash.shopcredits.repairorder.HourBucket;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for the production credit ledger.
 *
 * @param source how responsible employees and close-time expectations are resolved
 * @param recompute schedule of the background recompute sweep
 * @param milestones the milestone table; validated by {@link MilestonePolicy}
 */
@ConfigurationProperties(prefix = "credit")
public record CreditProperties(
    @DefaultValue("FIXED_ROLE") CreditSourceMode source,
    @DefaultValue Recompute recompute,
    List<MilestoneProperties> milestones) {

  public record Recompute(@DefaultValue("0 0 3 * * *") String cron) {}

  public record MilestoneProperties(
      String id,
      String label,
      String fromStage,
      TargetMatch match,
      String targetStage,
      HourBucket bucket,
      EmployeeRole role,
      BigDecimal share) {}
}
