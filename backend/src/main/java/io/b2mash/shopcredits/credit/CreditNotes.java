package io.b2mash.shopcredits.credit;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/** Formats and parses the notes that identify generated credit rows. */
public final class CreditNotes {

  public static final String CLOSE_ADJUSTMENT = "Adjustment on close (recalc)";

  private static final Pattern SUPPLEMENT =
      Pattern.compile("^Supplement ([+-])(\\d+(?:\\.\\d+)?)h \\((.+)\\)$");

  private CreditNotes() {}

  /** e.g. {@code Body 60% of 40.00h on Body→Paint}. */
  public static String baseline(
      Milestone milestone, BigDecimal baseHours, String fromStage, String toStage) {
    return String.format(
        Locale.ROOT, "%s of %.2fh on %s→%s", milestone.label(), baseHours, fromStage, toStage);
  }

  /** e.g. {@code Supplement +10.00h (Body 60%)}. */
  public static String supplement(Milestone milestone, BigDecimal deltaHours) {
    return String.format(
        Locale.ROOT,
        "Supplement %s%.2fh (%s)",
        deltaHours.signum() < 0 ? "-" : "+",
        deltaHours.abs(),
        milestone.label());
  }

  static String supplementPosting(String note, Long adjustmentId) {
    return note + " [adj " + adjustmentId + "]";
  }

  public static Optional<ParsedSupplement> parseSupplement(String note) {
    if (note == null) {
      return Optional.empty();
    }
    var matcher = SUPPLEMENT.matcher(note.strip());
    if (!matcher.matches()) {
      return Optional.empty();
    }
    int sign = "-".equals(matcher.group(1)) ? -1 : 1;
    return Optional.of(new ParsedSupplement(sign, matcher.group(3)));
  }

  /**
   * Sign and milestone label recovered from a supplement note.
   *
   * @param sign +1 or -1
   */
  public record ParsedSupplement(int sign, String milestoneLabel) {}
}
