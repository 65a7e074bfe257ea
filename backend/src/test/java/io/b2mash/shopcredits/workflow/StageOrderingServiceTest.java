package io.b2mash.shopcredits.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.shopcredits.exception.InvalidStateException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StageOrderingServiceTest {

  @Mock private WorkflowStageRepository workflowStageRepository;
  @InjectMocks private StageOrderingService service;

  @Test
  void current_readsStagesInConfiguredOrder() {
    when(workflowStageRepository.findAllOrdered())
        .thenReturn(List.of(new WorkflowStage("Intake", 1), new WorkflowStage("Body", 2)));

    assertThat(service.current().stages()).containsExactly("Intake", "Body");
  }

  @Test
  void replaceStages_rejectsDuplicates() {
    assertThatThrownBy(() -> service.replaceStages(List.of("Body", "Paint", "Body")))
        .isInstanceOf(InvalidStateException.class);
    verify(workflowStageRepository, never()).deleteAllStages();
  }

  @Test
  void replaceStages_rejectsBlankNames() {
    assertThatThrownBy(() -> service.replaceStages(List.of("Body", " ")))
        .isInstanceOf(InvalidStateException.class);
    verify(workflowStageRepository, never()).save(any());
  }

  @Test
  void replaceStages_returnsNewOrdering() {
    var ordering = service.replaceStages(List.of("Intake", " Body ", "Paint"));

    assertThat(ordering.stages()).containsExactly("Intake", "Body", "Paint");
    verify(workflowStageRepository).deleteAllStages();
  }
}
