package io.b2mash.shopcredits.timeclock;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** One clocked work session. Rows are loaded by the shop's time clock import. */
@Entity
@Table(name = "time_clock_entries")
public class TimeClockEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "work_date", nullable = false)
  private LocalDate workDate;

  @Column(name = "employee", nullable = false, length = 200)
  private String employee;

  @Column(name = "clock_in")
  private Instant clockIn;

  @Column(name = "clock_out")
  private Instant clockOut;

  @Column(name = "hours_worked", nullable = false, precision = 14, scale = 6)
  private BigDecimal hoursWorked;

  protected TimeClockEntry() {}

  public TimeClockEntry(
      LocalDate workDate,
      String employee,
      Instant clockIn,
      Instant clockOut,
      BigDecimal hoursWorked) {
    this.workDate = workDate;
    this.employee = employee;
    this.clockIn = clockIn;
    this.clockOut = clockOut;
    this.hoursWorked = hoursWorked;
  }

  public UUID getId() {
    return id;
  }

  public LocalDate getWorkDate() {
    return workDate;
  }

  public String getEmployee() {
    return employee;
  }

  public Instant getClockIn() {
    return clockIn;
  }

  public Instant getClockOut() {
    return clockOut;
  }

  public BigDecimal getHoursWorked() {
    return hoursWorked;
  }
}
