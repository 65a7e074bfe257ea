package io.b2mash.shopcredits.repairorder;

/** Named hour quantities carried by a repair order. */
public enum HourBucket {
  TOTAL,
  BODY,
  REFINISH,
  MECHANICAL
}
