package io.b2mash.shopcredits.stagelog;

import java.time.Instant;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StageTransitionController {

  private final StageTransitionService stageTransitionService;

  public StageTransitionController(StageTransitionService stageTransitionService) {
    this.stageTransitionService = stageTransitionService;
  }

  @GetMapping("/api/repair-orders/{roNumber}/transitions")
  public ResponseEntity<List<TransitionResponse>> listTransitions(@PathVariable String roNumber) {
    return ResponseEntity.ok(
        stageTransitionService.transitionsFor(roNumber).stream()
            .map(TransitionResponse::from)
            .toList());
  }

  public record TransitionResponse(
      Long id, String roNumber, String fromStage, String toStage, Instant occurredAt) {

    public static TransitionResponse from(StageTransition t) {
      return new TransitionResponse(
          t.getId(), t.getRoNumber(), t.getFromStage(), t.getToStage(), t.getOccurredAt());
    }
  }
}
