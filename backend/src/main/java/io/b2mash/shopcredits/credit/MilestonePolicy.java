package io.b2mash.shopcredits.credit;

import io.b2mash.shopcredits.repairorder.EmployeeRole;
import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Static milestone table bound from {@code credit.milestones}. Fails fast on invalid entries. */
@Component
public class MilestonePolicy {

  private static final Logger log = LoggerFactory.getLogger(MilestonePolicy.class);

  private final List<Milestone> milestones;

  @Autowired
  public MilestonePolicy(CreditProperties properties) {
    this(toMilestones(properties.milestones()));
  }

  MilestonePolicy(List<Milestone> milestones) {
    validate(milestones);
    this.milestones = List.copyOf(milestones);
    log.info("Loaded {} credit milestones", this.milestones.size());
  }

  public List<Milestone> milestones() {
    return milestones;
  }

  public Optional<Milestone> findById(String id) {
    return milestones.stream().filter(m -> m.id().equals(id)).findFirst();
  }

  public Optional<Milestone> findByLabel(String label) {
    return milestones.stream().filter(m -> m.label().equals(label)).findFirst();
  }

  /** Sum of the shares paid to a role out of its own bucket across all milestones. */
  public BigDecimal totalShareFor(EmployeeRole role) {
    return milestones.stream()
        .filter(m -> m.role() == role && m.bucket() == role.bucket())
        .map(Milestone::share)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  /** Baseline notes start with the milestone label, e.g. "Body 60% of 40.00h on Body→Paint". */
  public boolean isBaselineNote(String note) {
    return note != null && milestones.stream().anyMatch(m -> note.startsWith(m.label() + " of "));
  }

  private static List<Milestone> toMilestones(List<CreditProperties.MilestoneProperties> props) {
    if (props == null) {
      return List.of();
    }
    return props.stream()
        .map(
            p ->
                new Milestone(
                    p.id(),
                    p.label(),
                    p.fromStage(),
                    p.match(),
                    p.targetStage(),
                    p.bucket(),
                    p.role(),
                    p.share()))
        .toList();
  }

  private static void validate(List<Milestone> milestones) {
    var ids = new HashSet<String>();
    var labels = new HashSet<String>();
    for (var m : milestones) {
      if (m.id() == null || m.id().isBlank()) {
        throw new IllegalStateException("Milestone id must not be blank");
      }
      if (!ids.add(m.id())) {
        throw new IllegalStateException("Duplicate milestone id: " + m.id());
      }
      if (m.label() == null || m.label().isBlank() || !labels.add(m.label())) {
        throw new IllegalStateException("Milestone " + m.id() + " needs a unique label");
      }
      if (m.fromStage() == null
          || m.fromStage().isBlank()
          || m.targetStage() == null
          || m.targetStage().isBlank()) {
        throw new IllegalStateException("Milestone " + m.id() + " needs from and target stages");
      }
      if (m.match() == null || m.bucket() == null || m.role() == null) {
        throw new IllegalStateException("Milestone " + m.id() + " needs match, bucket and role");
      }
      if (m.share() == null
          || m.share().signum() <= 0
          || m.share().compareTo(BigDecimal.ONE) > 0) {
        throw new IllegalStateException(
            "Milestone " + m.id() + " share must be in (0, 1], was " + m.share());
      }
    }
  }
}
