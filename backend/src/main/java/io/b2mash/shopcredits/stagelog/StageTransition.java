package io.b2mash.shopcredits.stagelog;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Immutable record of one stage change. The identity column doubles as the append sequence and
 * breaks ties between transitions that share a timestamp.
 */
@Entity
@Table(name = "stage_transitions")
public class StageTransition {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "ro_number", nullable = false, updatable = false, length = 50)
  private String roNumber;

  @Column(name = "from_stage", nullable = false, updatable = false, length = 100)
  private String fromStage;

  @Column(name = "to_stage", nullable = false, updatable = false, length = 100)
  private String toStage;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  protected StageTransition() {}

  public StageTransition(String roNumber, String fromStage, String toStage, Instant occurredAt) {
    this.roNumber = roNumber;
    this.fromStage = fromStage;
    this.toStage = toStage;
    this.occurredAt = occurredAt;
  }

  public Long getId() {
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

  public Instant getOccurredAt() {
    return occurredAt;
  }

  /** Calendar date of the transition in the server's zone, used to date credit rows. */
  public LocalDate occurredOn() {
    return LocalDate.ofInstant(occurredAt, ZoneId.systemDefault());
  }
}
