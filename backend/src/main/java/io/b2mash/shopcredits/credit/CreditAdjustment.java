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

/**
 * Signed change of a milestone's bucket after its baseline was captured. {@code deltaHours} is in
 * bucket hours, before the share is applied.
 */
@Entity
@Table(name = "credit_adjustments")
public class CreditAdjustment {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "ro_number", nullable = false, updatable = false, length = 50)
  private String roNumber;

  @Column(name = "milestone_id", nullable = false, updatable = false, length = 50)
  private String milestoneId;

  @Column(name = "delta_hours", nullable = false, updatable = false, precision = 14, scale = 6)
  private BigDecimal deltaHours;

  @Column(name = "from_stage", nullable = false, updatable = false, length = 100)
  private String fromStage;

  @Column(name = "to_stage", nullable = false, updatable = false, length = 100)
  private String toStage;

  @Column(name = "adjustment_date", nullable = false, updatable = false)
  private LocalDate adjustmentDate;

  @Column(name = "tech", updatable = false, length = 200)
  private String tech;

  @Column(name = "share", nullable = false, updatable = false, precision = 7, scale = 6)
  private BigDecimal share;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected CreditAdjustment() {}

  public CreditAdjustment(
      String roNumber,
      String milestoneId,
      BigDecimal deltaHours,
      String fromStage,
      String toStage,
      LocalDate adjustmentDate,
      String tech,
      BigDecimal share) {
    this.roNumber = roNumber;
    this.milestoneId = milestoneId;
    this.deltaHours = deltaHours;
    this.fromStage = fromStage;
    this.toStage = toStage;
    this.adjustmentDate = adjustmentDate;
    this.tech = tech;
    this.share = share;
    this.createdAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public String getRoNumber() {
    return roNumber;
  }

  public String getMilestoneId() {
    return milestoneId;
  }

  public BigDecimal getDeltaHours() {
    return deltaHours;
  }

  public String getFromStage() {
    return fromStage;
  }

  public String getToStage() {
    return toStage;
  }

  public LocalDate getAdjustmentDate() {
    return adjustmentDate;
  }

  public String getTech() {
    return tech;
  }

  public BigDecimal getShare() {
    return share;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
