package io.buildunion.factcore.task.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.buildunion.factcore.citation.LedgerSnapshot;
import io.buildunion.factcore.event.TaskChangedEvent;
import io.buildunion.factcore.project.ProjectFinancialSummary;
import io.buildunion.factcore.task.Task;
import io.buildunion.factcore.task.TaskPriority;
import io.buildunion.factcore.task.TaskRepository;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
class TaskBootstrapServiceTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();

  @Mock private TaskRepository taskRepository;
  @Mock private TransactionTemplate transactionTemplate;
  @Mock private ApplicationEventPublisher eventPublisher;

  private TaskBootstrapService service;

  private final ProjectFinancialSummary financial =
      new ProjectFinancialSummary(
          PROJECT_ID, null, null, null, LocalDate.of(2025, 5, 1), LocalDate.of(2025, 5, 31));

  @BeforeEach
  void setUp() {
    service =
        new TaskBootstrapService(
            taskRepository, new TaskPhaseScheduler(), transactionTemplate, eventPublisher);
  }

  @Test
  void generatesSixTasksForProjectWithoutDemolition() {
    runTransactionsInline();
    when(taskRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));

    var saved = service.bootstrapIfEmpty(PROJECT_ID, List.of(), LedgerSnapshot.empty(), financial);

    assertThat(saved).hasSize(6);
    verify(eventPublisher, times(6)).publishEvent(any(TaskChangedEvent.class));
  }

  @Test
  void existingTasksSkipGeneration() {
    var existing =
        new Task(PROJECT_ID, "Permit", null, TaskPriority.MEDIUM, null, null, null);

    var saved =
        service.bootstrapIfEmpty(
            PROJECT_ID, List.of(existing), LedgerSnapshot.empty(), financial);

    assertThat(saved).isEmpty();
    verifyNoInteractions(transactionTemplate, taskRepository);
  }

  @Test
  void unresolvableDatesSkipGeneration() {
    var saved = service.bootstrapIfEmpty(PROJECT_ID, List.of(), LedgerSnapshot.empty(), null);

    assertThat(saved).isEmpty();
    verifyNoInteractions(transactionTemplate);
  }

  @Test
  void failedBatchInsertsNothingAndDoesNotThrow() {
    when(transactionTemplate.execute(any()))
        .thenThrow(new DataIntegrityViolationException("insert failed"));

    var saved = service.bootstrapIfEmpty(PROJECT_ID, List.of(), LedgerSnapshot.empty(), financial);

    assertThat(saved).isEmpty();
    verify(eventPublisher, never()).publishEvent(any(Object.class));
  }

  private void runTransactionsInline() {
    when(transactionTemplate.execute(any()))
        .thenAnswer(
            invocation -> {
              TransactionCallback<?> callback = invocation.getArgument(0);
              return callback.doInTransaction(null);
            });
  }
}
