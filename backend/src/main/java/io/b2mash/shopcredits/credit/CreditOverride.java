package io.b2mash.shopcredits.credit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Operator correction of a generated credit row. The key columns mirror the row identity; null
 * replacement fields leave the generated value in place.
 */
@Entity
@Table(
    name = "credit_overrides",
    uniqueConstraints =
        @UniqueConstraint(columnNames = {"ro_number", "from_stage", "to_stage", "note"}))
public class CreditOverride {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "ro_number", nullable = false, updatable = false, length = 50)
  private String roNumber;

  @Column(name = "from_stage", nullable = false, updatable = false, length = 100)
  private String fromStage;

  @Column(name = "to_stage", nullable = false, updatable = false, length = 100)
  private String toStage;

  @Column(name = "note", nullable = false, updatable = false, length = 300)
  private String note;

  @Column(name = "override_date")
  private LocalDate overrideDate;

  @Column(name = "tech", length = 200)
  private String tech;

  @Column(name = "hours", precision = 14, scale = 6)
  private BigDecimal hours;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected CreditOverride() {}

  public CreditOverride(CreditRowKey key, LocalDate overrideDate, String tech, BigDecimal hours) {
    this.roNumber = key.roNumber();
    this.fromStage = key.fromStage();
    this.toStage = key.toStage();
    this.note = key.note();
    this.overrideDate = overrideDate;
    this.tech = tech;
    this.hours = hours;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void replace(LocalDate overrideDate, String tech, BigDecimal hours) {
    this.overrideDate = overrideDate;
    this.tech = tech;
    this.hours = hours;
    this.updatedAt = Instant.now();
  }

  public CreditRowKey key() {
    return new CreditRowKey(roNumber, fromStage, toStage, note);
  }

  public UUID getId() {
    return id;
  }

  public String getRoNumber() {
    return roNumber;
  }

  public String getFromStage() {
    return fromStage;
  }

  public String getToStage() {
    return toStage;
  }

  public String getNote() {
    return note;
  }

  public LocalDate getOverrideDate() {
    return overrideDate;
  }

  public String getTech() {
    return tech;
  }

  public BigDecimal getHours() {
    return hours;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
