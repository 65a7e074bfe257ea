package io.b2mash.shopcredits.timeclock;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class TimeClockWorkedHoursSource implements WorkedHoursSource {

  private final TimeClockEntryRepository timeClockEntryRepository;

  public TimeClockWorkedHoursSource(TimeClockEntryRepository timeClockEntryRepository) {
    this.timeClockEntryRepository = timeClockEntryRepository;
  }

  @Override
  @Transactional(readOnly = true)
  public Map<String, BigDecimal> workedHoursByEmployee(LocalDate from, LocalDate to) {
    return timeClockEntryRepository.sumHoursByEmployee(from, to).stream()
        .filter(row -> row.getEmployee() != null && !row.getEmployee().isBlank())
        .collect(
            Collectors.toMap(
                row -> row.getEmployee().strip(),
                row -> row.getHours() != null ? row.getHours() : BigDecimal.ZERO,
                BigDecimal::add));
  }
}
