package io.b2mash.shopcredits.repairorder;

/** Workshop roles that can be credited, each drawing from one hour bucket. */
public enum EmployeeRole {
  ESTIMATOR(HourBucket.TOTAL),
  BODY_TECHNICIAN(HourBucket.BODY),
  PAINTER(HourBucket.REFINISH),
  MECHANIC(HourBucket.MECHANICAL);

  private final HourBucket bucket;

  EmployeeRole(HourBucket bucket) {
    this.bucket = bucket;
  }

  public HourBucket bucket() {
    return bucket;
  }
}
