package io.b2mash.shopcredits.workflow;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/workflow/stages")
public class WorkflowStageController {

  private final StageOrderingService stageOrderingService;

  public WorkflowStageController(StageOrderingService stageOrderingService) {
    this.stageOrderingService = stageOrderingService;
  }

  @GetMapping
  public ResponseEntity<StagesResponse> getStages() {
    return ResponseEntity.ok(new StagesResponse(stageOrderingService.current().stages()));
  }

  @PutMapping
  public ResponseEntity<StagesResponse> replaceStages(
      @Valid @RequestBody ReplaceStagesRequest request) {
    var ordering = stageOrderingService.replaceStages(request.stages());
    return ResponseEntity.ok(new StagesResponse(ordering.stages()));
  }

  // --- DTOs ---

  public record ReplaceStagesRequest(
      @NotEmpty(message = "stages is required") List<String> stages) {}

  public record StagesResponse(List<String> stages) {}
}
