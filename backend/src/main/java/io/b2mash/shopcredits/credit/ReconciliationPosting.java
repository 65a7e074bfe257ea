package io.b2mash.shopcredits.credit;

import java.math.BigDecimal;

/** One close-time true-up entry: the signed difference between expected and posted credit. */
public record ReconciliationPosting(
    String employee, BigDecimal expected, BigDecimal posted, BigDecimal difference) {}
