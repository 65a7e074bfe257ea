package io.b2mash.shopcredits.workflow;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface WorkflowStageRepository extends JpaRepository<WorkflowStage, UUID> {

  @Query("SELECT ws FROM WorkflowStage ws ORDER BY ws.orderIndex ASC, ws.name ASC")
  List<WorkflowStage> findAllOrdered();

  @Modifying
  @Query("DELETE FROM WorkflowStage ws")
  void deleteAllStages();
}
