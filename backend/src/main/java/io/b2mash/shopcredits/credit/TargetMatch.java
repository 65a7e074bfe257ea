package io.b2mash.shopcredits.credit;

import io.b2mash.shopcredits.workflow.StageOrdering;

/** How a transition's destination stage must relate to a milestone's target stage. */
public enum TargetMatch {
  AT_OR_AFTER {
    @Override
    public boolean test(StageOrdering ordering, String toStage, String targetStage) {
      return ordering.isAtOrAfter(toStage, targetStage);
    }
  },
  STRICTLY_AFTER {
    @Override
    public boolean test(StageOrdering ordering, String toStage, String targetStage) {
      return ordering.isAfter(toStage, targetStage);
    }
  };

  public abstract boolean test(StageOrdering ordering, String toStage, String targetStage);
}
