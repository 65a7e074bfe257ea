package io.b2mash.shopcredits.repairorder;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** Percentage of a role's hour bucket allocated to one employee on a repair order. */
@Entity
@Table(name = "ro_hours_allocations")
public class HoursAllocation {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "ro_number", nullable = false, length = 50)
  private String roNumber;

  @Column(name = "employee", nullable = false, length = 200)
  private String employee;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, length = 30)
  private EmployeeRole role;

  @Column(name = "percent", nullable = false, precision = 7, scale = 4)
  private BigDecimal percent;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected HoursAllocation() {}

  public HoursAllocation(String roNumber, String employee, EmployeeRole role, BigDecimal percent) {
    this.roNumber = roNumber;
    this.employee = employee;
    this.role = role;
    this.percent = percent;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getRoNumber() {
    return roNumber;
  }

  public String getEmployee() {
    return employee;
  }

  public EmployeeRole getRole() {
    return role;
  }

  public BigDecimal getPercent() {
    return percent;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
