package io.b2mash.shopcredits.credit;

public enum CreditRowOrigin {
  BASELINE,
  SUPPLEMENT
}
