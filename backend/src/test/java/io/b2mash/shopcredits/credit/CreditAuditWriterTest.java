package io.b2mash.shopcredits.credit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.shopcredits.repairorder.RepairOrderRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CreditAuditWriterTest {

  private static final LocalDate DATE = LocalDate.of(2025, 3, 4);

  @Mock private CreditAuditEntryRepository creditAuditEntryRepository;
  @Mock private RepairOrderRepository repairOrderRepository;
  @InjectMocks private CreditAuditWriter writer;

  @Test
  void postCreditOnce_skipsExistingEntry() {
    when(repairOrderRepository.existsByRoNumber("RO-1")).thenReturn(true);
    when(creditAuditEntryRepository.existsByRoNumberAndEmployeeAndNote("RO-1", "Alice", "n"))
        .thenReturn(true);

    assertThat(writer.postCreditOnce("RO-1", " Alice ", BigDecimal.TEN, "n", DATE)).isFalse();
    verify(creditAuditEntryRepository, never()).save(any());
  }

  @Test
  void postCreditOnce_insertsNormalisedEntry() {
    when(repairOrderRepository.existsByRoNumber("RO-1")).thenReturn(true);
    when(creditAuditEntryRepository.existsByRoNumberAndEmployeeAndNote("RO-1", "Alice", "n"))
        .thenReturn(false);

    assertThat(writer.postCreditOnce("RO-1", "Alice ", new BigDecimal("2.5"), "n", DATE)).isTrue();

    var captor = ArgumentCaptor.forClass(CreditAuditEntry.class);
    verify(creditAuditEntryRepository).save(captor.capture());
    assertThat(captor.getValue().getEmployee()).isEqualTo("Alice");
    assertThat(captor.getValue().getHours()).isEqualTo(new BigDecimal("2.500000"));
    assertThat(captor.getValue().getEntryDate()).isEqualTo(DATE);
  }

  @Test
  void postCredit_alwaysInserts() {
    when(repairOrderRepository.existsByRoNumber("RO-1")).thenReturn(true);

    assertThat(writer.postCredit("RO-1", "Alice", BigDecimal.ONE, "n", DATE)).isTrue();
    assertThat(writer.postCredit("RO-1", "Alice", BigDecimal.ONE, "n", DATE)).isTrue();
    verify(creditAuditEntryRepository, times(2)).save(any());
  }

  @Test
  void blankEmployeeOrNegligibleHoursAreNoOps() {
    assertThat(writer.postCredit("RO-1", " ", BigDecimal.ONE, "n", DATE)).isFalse();
    assertThat(writer.postCredit("RO-1", null, BigDecimal.ONE, "n", DATE)).isFalse();
    assertThat(writer.postCreditOnce("RO-1", "Alice", new BigDecimal("0.0000001"), "n", DATE))
        .isFalse();
    verify(creditAuditEntryRepository, never()).save(any());
  }

  @Test
  void missingRepairOrderIsSkippedSilently() {
    when(repairOrderRepository.existsByRoNumber("RO-gone")).thenReturn(false);

    assertThat(writer.postCredit("RO-gone", "Alice", BigDecimal.ONE, "n", DATE)).isFalse();
    verify(creditAuditEntryRepository, never()).save(any());
  }
}
