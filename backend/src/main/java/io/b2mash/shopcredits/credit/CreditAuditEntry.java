package io.b2mash.shopcredits.credit;

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

/** Posted credit line. Immutable once written. */
@Entity
@Table(name = "credit_audit_entries")
public class CreditAuditEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "entry_date", nullable = false, updatable = false)
  private LocalDate entryDate;

  @Column(name = "ro_number", nullable = false, updatable = false, length = 50)
  private String roNumber;

  @Column(name = "employee", nullable = false, updatable = false, length = 200)
  private String employee;

  @Column(name = "hours", nullable = false, updatable = false, precision = 14, scale = 6)
  private BigDecimal hours;

  @Column(name = "note", nullable = false, updatable = false, length = 320)
  private String note;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected CreditAuditEntry() {}

  public CreditAuditEntry(
      LocalDate entryDate, String roNumber, String employee, BigDecimal hours, String note) {
    this.entryDate = entryDate;
    this.roNumber = roNumber;
    this.employee = employee;
    this.hours = hours;
    this.note = note;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public LocalDate getEntryDate() {
    return entryDate;
  }

  public String getRoNumber() {
    return roNumber;
  }

  public String getEmployee() {
    return employee;
  }

  public BigDecimal getHours() {
    return hours;
  }

  public String getNote() {
    return note;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
