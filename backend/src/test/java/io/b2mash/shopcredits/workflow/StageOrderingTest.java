package io.b2mash.shopcredits.workflow;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class StageOrderingTest {

  private final StageOrdering ordering = StageOrdering.of("Intake", "Body", "Paint", "Detail");

  @Test
  void isAtOrAfter_includesTargetItself() {
    assertThat(ordering.isAtOrAfter("Paint", "Paint")).isTrue();
    assertThat(ordering.isAtOrAfter("Detail", "Paint")).isTrue();
    assertThat(ordering.isAtOrAfter("Body", "Paint")).isFalse();
  }

  @Test
  void isAfter_excludesTargetItself() {
    assertThat(ordering.isAfter("Paint", "Paint")).isFalse();
    assertThat(ordering.isAfter("Detail", "Paint")).isTrue();
  }

  @Test
  void unknownStagesNeverMatch() {
    assertThat(ordering.isAtOrAfter("Sublet", "Paint")).isFalse();
    assertThat(ordering.isAtOrAfter("Detail", "Sublet")).isFalse();
    assertThat(ordering.isAfter(null, "Paint")).isFalse();
    assertThat(ordering.indexOf("paint")).isEqualTo(-1);
  }

  @Test
  void firstReturnsNullForEmptyOrdering() {
    assertThat(ordering.first()).isEqualTo("Intake");
    assertThat(StageOrdering.of().first()).isNull();
  }
}
