package io.b2mash.shopcredits.workflow;

import io.b2mash.shopcredits.exception.InvalidStateException;
import java.util.HashSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolves the workshop stage order from the database. Callers obtain a fresh {@link
 * StageOrdering} per operation so that renamed or reordered stages take effect immediately.
 */
@Service
public class StageOrderingService {

  private static final Logger log = LoggerFactory.getLogger(StageOrderingService.class);

  private final WorkflowStageRepository workflowStageRepository;

  public StageOrderingService(WorkflowStageRepository workflowStageRepository) {
    this.workflowStageRepository = workflowStageRepository;
  }

  @Transactional(readOnly = true)
  public StageOrdering current() {
    return new StageOrdering(
        workflowStageRepository.findAllOrdered().stream().map(WorkflowStage::getName).toList());
  }

  @Transactional
  public StageOrdering replaceStages(List<String> stageNames) {
    if (stageNames == null || stageNames.isEmpty()) {
      throw new InvalidStateException("Invalid stages", "At least one stage is required");
    }
    var seen = new HashSet<String>();
    for (String name : stageNames) {
      if (name == null || name.isBlank()) {
        throw new InvalidStateException("Invalid stages", "Stage names must not be blank");
      }
      if (!seen.add(name.strip())) {
        throw new InvalidStateException("Invalid stages", "Duplicate stage name: " + name);
      }
    }

    var names = stageNames.stream().map(String::strip).toList();
    workflowStageRepository.deleteAllStages();
    workflowStageRepository.flush();
    for (int i = 0; i < names.size(); i++) {
      workflowStageRepository.save(new WorkflowStage(names.get(i), i + 1));
    }
    log.info("Replaced workflow stages with {}", names);
    return new StageOrdering(names);
  }
}
