package io.b2mash.shopcredits.credit;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class CreditNotesTest {

  private final Milestone body60 = InMemoryLedger.defaultMilestones().get(0);

  @Test
  void baselineNoteUsesTwoDecimalsAndStagePair() {
    assertThat(CreditNotes.baseline(body60, new BigDecimal("40"), "Body", "Paint"))
        .isEqualTo("Body 60% of 40.00h on Body→Paint");
    assertThat(CreditNotes.baseline(body60, new BigDecimal("12.345"), "Body", "QC"))
        .isEqualTo("Body 60% of 12.35h on Body→QC");
  }

  @Test
  void supplementNoteCarriesSignAndMagnitude() {
    assertThat(CreditNotes.supplement(body60, new BigDecimal("10")))
        .isEqualTo("Supplement +10.00h (Body 60%)");
    assertThat(CreditNotes.supplement(body60, new BigDecimal("-2.5")))
        .isEqualTo("Supplement -2.50h (Body 60%)");
  }

  @Test
  void parseSupplementRecoversSignAndLabel() {
    var parsed = CreditNotes.parseSupplement("Supplement -2.50h (Body 60%)");

    assertThat(parsed).isPresent();
    assertThat(parsed.get().sign()).isEqualTo(-1);
    assertThat(parsed.get().milestoneLabel()).isEqualTo("Body 60%");
  }

  @Test
  void parseSupplementRejectsOtherNotes() {
    assertThat(CreditNotes.parseSupplement("Body 60% of 40.00h on Body→Paint")).isEmpty();
    assertThat(CreditNotes.parseSupplement(CreditNotes.CLOSE_ADJUSTMENT)).isEmpty();
    assertThat(CreditNotes.parseSupplement(null)).isEmpty();
  }

  @Test
  void supplementPostingIsDistinctPerAdjustment() {
    String note = CreditNotes.supplement(body60, new BigDecimal("10"));

    assertThat(CreditNotes.supplementPosting(note, 7L))
        .isEqualTo("Supplement +10.00h (Body 60%) [adj 7]")
        .isNotEqualTo(CreditNotes.supplementPosting(note, 8L));
  }
}
