package io.b2mash.shopcredits.timeclock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TimeClockWorkedHoursSourceTest {

  @Mock private TimeClockEntryRepository timeClockEntryRepository;
  @InjectMocks private TimeClockWorkedHoursSource source;

  @Test
  void mergesNamesThatDifferOnlyByWhitespaceAndDropsBlanks() {
    when(timeClockEntryRepository.sumHoursByEmployee(null, null))
        .thenReturn(List.of(row("Alice", "8"), row("Alice ", "4.5"), row(" ", "2")));

    var worked = source.workedHoursByEmployee(null, null);

    assertThat(worked).containsOnlyKeys("Alice");
    assertThat(worked.get("Alice")).isEqualByComparingTo("12.5");
  }

  private static EmployeeWorkedHours row(String employee, String hours) {
    return new EmployeeWorkedHours() {
      @Override
      public String getEmployee() {
        return employee;
      }

      @Override
      public BigDecimal getHours() {
        return new BigDecimal(hours);
      }
    };
  }
}
