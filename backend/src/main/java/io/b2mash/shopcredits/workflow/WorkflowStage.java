package io.b2mash.shopcredits.workflow;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "workflow_stages")
public class WorkflowStage {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, unique = true, length = 100)
  private String name;

  @Column(name = "order_index", nullable = false)
  private int orderIndex;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected WorkflowStage() {}

  public WorkflowStage(String name, int orderIndex) {
    this.name = name;
    this.orderIndex = orderIndex;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public int getOrderIndex() {
    return orderIndex;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
