package io.buildunion.factcore.citation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.buildunion.factcore.config.FactCoreProperties;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

@ExtendWith(MockitoExtension.class)
class FactFlushServiceTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();

  @Mock private ProjectFactsStore store;

  private FactFlushService service;

  @BeforeEach
  void setUp() {
    var properties =
        new FactCoreProperties(new FactCoreProperties.Facts(2, 1, 1, 10), null, null, null);
    service = new FactFlushService(store, Runnable::run, properties);
  }

  @Test
  void emptyCandidatesCompleteWithoutTouchingStore() {
    var outcome = service.flush(PROJECT_ID, "budget", List.of()).join();

    assertThat(outcome.written()).isEmpty();
    assertThat(outcome.failed()).isFalse();
    verify(store, never()).mergeAbsent(any(), any());
  }

  @Test
  void flushReportsWrittenAndSkipped() {
    var kept = citation("synth-contract-a-1", "a");
    var dropped = citation("synth-contract-b-1", "b");
    when(store.mergeAbsent(PROJECT_ID, List.of(kept, dropped))).thenReturn(List.of(kept));

    var outcome = service.flush(PROJECT_ID, "contract", List.of(kept, dropped)).join();

    assertThat(outcome.written()).containsExactly(kept);
    assertThat(outcome.skipped()).isEqualTo(1);
    assertThat(outcome.attempts()).isEqualTo(1);
  }

  @Test
  void versionConflictIsRetried() {
    var candidate = citation("synth-contract-a-1", "a");
    when(store.mergeAbsent(eq(PROJECT_ID), any()))
        .thenThrow(new ObjectOptimisticLockingFailureException(ProjectFacts.class, PROJECT_ID))
        .thenReturn(List.of(candidate));

    var outcome = service.flush(PROJECT_ID, "contract", List.of(candidate)).join();

    assertThat(outcome.failed()).isFalse();
    assertThat(outcome.attempts()).isEqualTo(2);
    assertThat(outcome.written()).containsExactly(candidate);
  }

  @Test
  void givesUpAfterConfiguredRetries() {
    var candidate = citation("synth-contract-a-1", "a");
    when(store.mergeAbsent(eq(PROJECT_ID), any()))
        .thenThrow(new ObjectOptimisticLockingFailureException(ProjectFacts.class, PROJECT_ID));

    var outcome = service.flush(PROJECT_ID, "contract", List.of(candidate)).join();

    assertThat(outcome.failed()).isTrue();
    assertThat(outcome.attempts()).isEqualTo(3);
    verify(store, times(3)).mergeAbsent(eq(PROJECT_ID), any());
  }

  @Test
  void storeFailureIsNotPropagated() {
    var candidate = citation("synth-contract-a-1", "a");
    when(store.mergeAbsent(eq(PROJECT_ID), any()))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    var outcome = service.flush(PROJECT_ID, "contract", List.of(candidate)).join();

    assertThat(outcome.failed()).isTrue();
    assertThat(outcome.attempts()).isEqualTo(1);
  }

  @Test
  void rejectedSubmissionCompletesAsFailedFlush() {
    var properties =
        new FactCoreProperties(new FactCoreProperties.Facts(2, 1, 1, 10), null, null, null);
    var saturated =
        new FactFlushService(
            store,
            task -> {
              throw new RejectedExecutionException("queue full");
            },
            properties);
    var candidate = citation("synth-contract-a-1", "a");

    var outcome = saturated.flush(PROJECT_ID, "contract", List.of(candidate)).join();

    assertThat(outcome.failed()).isTrue();
    assertThat(outcome.attempts()).isZero();
    verify(store, never()).mergeAbsent(any(), any());
  }

  private static Citation citation(String id, String contractId) {
    return new Citation(
        id,
        "CONTRACT",
        "contract",
        "Contract #" + contractId,
        contractId,
        Map.of("contract_id", contractId),
        Instant.now(),
        Provenance.SYNTHETIC);
  }
}
