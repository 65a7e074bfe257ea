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
import java.util.UUID;

/** Bucket value captured the first time a milestone is reached. Never updated. */
@Entity
@Table(
    name = "credit_baselines",
    uniqueConstraints = @UniqueConstraint(columnNames = {"ro_number", "milestone_id"}))
public class CreditBaseline {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "ro_number", nullable = false, updatable = false, length = 50)
  private String roNumber;

  @Column(name = "milestone_id", nullable = false, updatable = false, length = 50)
  private String milestoneId;

  @Column(name = "base_hours", nullable = false, updatable = false, precision = 14, scale = 6)
  private BigDecimal baseHours;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected CreditBaseline() {}

  public CreditBaseline(String roNumber, String milestoneId, BigDecimal baseHours) {
    this.roNumber = roNumber;
    this.milestoneId = milestoneId;
    this.baseHours = baseHours;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getRoNumber() {
    return roNumber;
  }

  public String getMilestoneId() {
    return milestoneId;
  }

  public BigDecimal getBaseHours() {
    return baseHours;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
