package io.b2mash.shopcredits.stagelog;

import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only log of repair order stage changes. Stage names are stored verbatim; validating them
 * against the configured stage list is the caller's job.
 */
@Service
public class StageTransitionService {

  private static final Logger log = LoggerFactory.getLogger(StageTransitionService.class);

  private final StageTransitionRepository stageTransitionRepository;

  public StageTransitionService(StageTransitionRepository stageTransitionRepository) {
    this.stageTransitionRepository = stageTransitionRepository;
  }

  @Transactional
  public StageTransition recordTransition(
      String roNumber, String fromStage, String toStage, Instant when) {
    var saved =
        stageTransitionRepository.save(new StageTransition(roNumber, fromStage, toStage, when));
    log.info("Recorded stage transition {} -> {} for RO {}", fromStage, toStage, roNumber);
    return saved;
  }

  @Transactional(readOnly = true)
  public List<StageTransition> transitionsFor(String roNumber) {
    return stageTransitionRepository.findByRoNumberInLogOrder(roNumber);
  }
}
