package io.b2mash.shopcredits.credit;

public enum CreditSourceMode {
  /** One named employee per role field on the RO. */
  FIXED_ROLE,
  /** Percent allocations per employee from the RO's allocation table. */
  ALLOCATION
}
