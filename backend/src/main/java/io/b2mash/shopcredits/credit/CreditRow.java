package io.b2mash.shopcredits.credit;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One generated production credit line, optionally patched by an override. The (RO, from, to,
 * note) identity is never changed by an override.
 *
 * @param adjustmentId source adjustment for {@link CreditRowOrigin#SUPPLEMENT} rows, null for
 *     baseline rows
 */
public record CreditRow(
    LocalDate date,
    String roNumber,
    String fromStage,
    String toStage,
    String employee,
    BigDecimal hours,
    String note,
    CreditRowOrigin origin,
    String milestoneId,
    Long adjustmentId,
    boolean overridden) {

  public CreditRowKey key() {
    return new CreditRowKey(roNumber, fromStage, toStage, note);
  }

  /** Note written to the audit log; supplements carry their adjustment id to stay distinct. */
  public String postingNote() {
    return origin == CreditRowOrigin.SUPPLEMENT
        ? CreditNotes.supplementPosting(note, adjustmentId)
        : note;
  }

  public CreditRow withOverride(CreditOverride override) {
    return new CreditRow(
        override.getOverrideDate() != null ? override.getOverrideDate() : date,
        roNumber,
        fromStage,
        toStage,
        override.getTech() != null && !override.getTech().isBlank()
            ? override.getTech().strip()
            : employee,
        override.getHours() != null ? override.getHours() : hours,
        note,
        origin,
        milestoneId,
        adjustmentId,
        true);
  }
}
