package io.buildunion.factcore.citation;

import io.buildunion.factcore.config.AsyncConfig;
import io.buildunion.factcore.config.FactCoreProperties;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.RetryContext;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Persists synthesized citations in the background. Each call is an independent flush: it re-reads
 * the stored collection, keeps only candidates whose key is still absent and writes the union
 * back. A version conflict re-runs the merge up to the configured retry count. Failures are logged
 * and never propagate; the in-memory ledger keeps the citations either way.
 */
@Service
public class FactFlushService {

  private static final Logger log = LoggerFactory.getLogger(FactFlushService.class);

  private final ProjectFactsStore store;
  private final Executor executor;
  private final RetryTemplate retryTemplate;

  public FactFlushService(
      ProjectFactsStore store,
      @Qualifier(AsyncConfig.FACT_FLUSH_EXECUTOR) Executor executor,
      FactCoreProperties properties) {
    this.store = store;
    this.executor = executor;
    this.retryTemplate =
        RetryTemplate.builder()
            .maxAttempts(Math.max(0, properties.facts().flushRetries()) + 1)
            .retryOn(
                List.of(ConcurrencyFailureException.class, DataIntegrityViolationException.class))
            .uniformRandomBackoff(10, 50)
            .build();
  }

  public CompletableFuture<FlushOutcome> flush(
      UUID projectId, String rule, List<Citation> candidates) {
    if (candidates.isEmpty()) {
      return CompletableFuture.completedFuture(new FlushOutcome(rule, List.of(), 0, 0, false));
    }
    try {
      return CompletableFuture.supplyAsync(() -> flushNow(projectId, rule, candidates), executor);
    } catch (RejectedExecutionException e) {
      log.warn(
          "Flush executor rejected rule {} for project {}, citations stay in memory only",
          rule,
          projectId,
          e);
      return CompletableFuture.completedFuture(FlushOutcome.failed(rule, 0));
    }
  }

  FlushOutcome flushNow(UUID projectId, String rule, List<Citation> candidates) {
    return retryTemplate.execute(
        context -> merge(projectId, rule, candidates, context.getRetryCount() + 1),
        context -> giveUp(projectId, rule, context));
  }

  private FlushOutcome merge(UUID projectId, String rule, List<Citation> candidates, int attempt) {
    if (attempt > 1) {
      log.debug(
          "Concurrent write while flushing rule {} for project {}, retrying (attempt {})",
          rule,
          projectId,
          attempt);
    }
    var written = store.mergeAbsent(projectId, candidates);
    int skipped = candidates.size() - written.size();
    if (skipped > 0) {
      log.debug(
          "Flush of rule {} for project {}: {} candidate(s) already persisted",
          rule,
          projectId,
          skipped);
    }
    if (!written.isEmpty()) {
      log.info(
          "Persisted {} synthesized citation(s) for project {} via rule {}",
          written.size(),
          projectId,
          rule);
    }
    return new FlushOutcome(rule, written, skipped, attempt, false);
  }

  private static FlushOutcome giveUp(UUID projectId, String rule, RetryContext context) {
    log.warn(
        "Giving up flush of rule {} for project {} after {} attempt(s)",
        rule,
        projectId,
        context.getRetryCount(),
        context.getLastThrowable());
    return FlushOutcome.failed(rule, context.getRetryCount());
  }
}
