package io.b2mash.shopcredits.credit;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.shopcredits.stagelog.StageTransition;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class MilestoneTest {

  private final List<Milestone> milestones = InMemoryLedger.defaultMilestones();
  private final Milestone body60 = milestones.get(0);
  private final Milestone body40 = milestones.get(1);

  @Test
  void atOrAfterMatchesTargetAndLaterStages() {
    assertThat(body60.matches(transition("Body", "Paint"), InMemoryLedger.STAGES)).isTrue();
    assertThat(body60.matches(transition("Body", "QC"), InMemoryLedger.STAGES)).isTrue();
    assertThat(body60.matches(transition("Body", "Disassembly"), InMemoryLedger.STAGES)).isFalse();
  }

  @Test
  void strictlyAfterExcludesTarget() {
    assertThat(body40.matches(transition("Reassembly", "Reassembly"), InMemoryLedger.STAGES))
        .isFalse();
    assertThat(body40.matches(transition("Reassembly", "Mechanical"), InMemoryLedger.STAGES))
        .isTrue();
  }

  @Test
  void originStageMustMatchExactly() {
    assertThat(body60.matches(transition("body", "Paint"), InMemoryLedger.STAGES)).isFalse();
    assertThat(body60.matches(transition("Disassembly", "Paint"), InMemoryLedger.STAGES)).isFalse();
  }

  @Test
  void firstMatchInReturnsEarliestMatchingTransition() {
    var first = transition("Body", "Paint");
    var later = transition("Body", "Reassembly");

    assertThat(
            body60.firstMatchIn(
                List.of(transition("Intake", "Body"), first, later), InMemoryLedger.STAGES))
        .containsSame(first);
    assertThat(body60.firstMatchIn(List.of(), InMemoryLedger.STAGES)).isEmpty();
  }

  @Test
  void unknownDestinationNeverMatches() {
    assertThat(body60.matches(transition("Body", "Sublet"), InMemoryLedger.STAGES)).isFalse();
  }

  private static StageTransition transition(String from, String to) {
    return new StageTransition("RO-1", from, to, Instant.parse("2025-01-01T10:00:00Z"));
  }
}
