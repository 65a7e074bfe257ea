package io.b2mash.shopcredits.repairorder;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "repair_orders")
public class RepairOrder {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "ro_number", nullable = false, unique = true, updatable = false, length = 50)
  private String roNumber;

  @Column(name = "opened_on", nullable = false)
  private LocalDate openedOn;

  @Column(name = "total_hours", nullable = false, precision = 14, scale = 6)
  private BigDecimal totalHours;

  @Column(name = "body_hours", nullable = false, precision = 14, scale = 6)
  private BigDecimal bodyHours = BigDecimal.ZERO;

  @Column(name = "refinish_hours", nullable = false, precision = 14, scale = 6)
  private BigDecimal refinishHours = BigDecimal.ZERO;

  @Column(name = "mechanical_hours", nullable = false, precision = 14, scale = 6)
  private BigDecimal mechanicalHours = BigDecimal.ZERO;

  @Column(name = "hours_taken", nullable = false, precision = 14, scale = 6)
  private BigDecimal hoursTaken = BigDecimal.ZERO;

  @Column(name = "hours_remaining", nullable = false, precision = 14, scale = 6)
  private BigDecimal hoursRemaining = BigDecimal.ZERO;

  @Column(name = "estimator", length = 200)
  private String estimator;

  @Column(name = "body_technician", length = 200)
  private String bodyTechnician;

  @Column(name = "painter", length = 200)
  private String painter;

  @Column(name = "mechanic", length = 200)
  private String mechanic;

  @Column(name = "current_stage", nullable = false, length = 100)
  private String currentStage;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private RepairOrderStatus status;

  @Version private Long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected RepairOrder() {}

  public RepairOrder(
      String roNumber, LocalDate openedOn, BigDecimal totalHours, String currentStage) {
    this.roNumber = roNumber;
    this.openedOn = openedOn;
    this.totalHours = totalHours;
    this.hoursRemaining = totalHours;
    this.currentStage = currentStage;
    this.status = RepairOrderStatus.OPEN;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Current value of the given hour bucket; never null. */
  public BigDecimal hoursFor(HourBucket bucket) {
    BigDecimal value =
        switch (bucket) {
          case TOTAL -> totalHours;
          case BODY -> bodyHours;
          case REFINISH -> refinishHours;
          case MECHANICAL -> mechanicalHours;
        };
    return value != null ? value : BigDecimal.ZERO;
  }

  /** Employee assigned to the role on this RO, or null when unassigned. */
  public String assigneeFor(EmployeeRole role) {
    String assignee =
        switch (role) {
          case ESTIMATOR -> estimator;
          case BODY_TECHNICIAN -> bodyTechnician;
          case PAINTER -> painter;
          case MECHANIC -> mechanic;
        };
    return assignee == null || assignee.isBlank() ? null : assignee.strip();
  }

  public void updateHours(
      BigDecimal totalHours,
      BigDecimal bodyHours,
      BigDecimal refinishHours,
      BigDecimal mechanicalHours) {
    this.totalHours = totalHours;
    this.bodyHours = bodyHours;
    this.refinishHours = refinishHours;
    this.mechanicalHours = mechanicalHours;
    this.updatedAt = Instant.now();
  }

  public void assign(String estimator, String bodyTechnician, String painter, String mechanic) {
    this.estimator = estimator;
    this.bodyTechnician = bodyTechnician;
    this.painter = painter;
    this.mechanic = mechanic;
    this.updatedAt = Instant.now();
  }

  public void moveToStage(String stage) {
    this.currentStage = stage;
    this.updatedAt = Instant.now();
  }

  public void changeStatus(RepairOrderStatus status) {
    this.status = status;
    this.updatedAt = Instant.now();
  }

  public void recordCreditTotals(BigDecimal hoursTaken, BigDecimal hoursRemaining) {
    this.hoursTaken = hoursTaken;
    this.hoursRemaining = hoursRemaining;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getRoNumber() {
    return roNumber;
  }

  public LocalDate getOpenedOn() {
    return openedOn;
  }

  public BigDecimal getTotalHours() {
    return totalHours;
  }

  public BigDecimal getBodyHours() {
    return bodyHours;
  }

  public BigDecimal getRefinishHours() {
    return refinishHours;
  }

  public BigDecimal getMechanicalHours() {
    return mechanicalHours;
  }

  public BigDecimal getHoursTaken() {
    return hoursTaken;
  }

  public BigDecimal getHoursRemaining() {
    return hoursRemaining;
  }

  public String getEstimator() {
    return estimator;
  }

  public String getBodyTechnician() {
    return bodyTechnician;
  }

  public String getPainter() {
    return painter;
  }

  public String getMechanic() {
    return mechanic;
  }

  public String getCurrentStage() {
    return currentStage;
  }

  public RepairOrderStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
