package io.b2mash.shopcredits.workflow;

import java.util.List;

/**
 * Snapshot of the configured workshop stage order. Stage names are compared case-sensitively; a
 * stage that is not part of the ordering never satisfies a positional predicate.
 */
public record StageOrdering(List<String> stages) {

  public StageOrdering {
    stages = List.copyOf(stages);
  }

  public static StageOrdering of(String... stages) {
    return new StageOrdering(List.of(stages));
  }

  /** Returns the zero-based position of the stage, or -1 when it is not configured. */
  public int indexOf(String stage) {
    return stage == null ? -1 : stages.indexOf(stage);
  }

  public boolean contains(String stage) {
    return indexOf(stage) >= 0;
  }

  public boolean isAtOrAfter(String stage, String target) {
    int stageIdx = indexOf(stage);
    int targetIdx = indexOf(target);
    return stageIdx >= 0 && targetIdx >= 0 && stageIdx >= targetIdx;
  }

  public boolean isAfter(String stage, String target) {
    int stageIdx = indexOf(stage);
    int targetIdx = indexOf(target);
    return stageIdx >= 0 && targetIdx >= 0 && stageIdx > targetIdx;
  }

  public String first() {
    return stages.isEmpty() ? null : stages.get(0);
  }
}
