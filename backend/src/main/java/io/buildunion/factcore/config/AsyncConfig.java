package io.buildunion.factcore.config;

import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executor for background persistence of synthesized citations. */
@Configuration
public class AsyncConfig {

  public static final String FACT_FLUSH_EXECUTOR = "factFlushExecutor";

  private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

  @Bean(name = FACT_FLUSH_EXECUTOR)
  public Executor factFlushExecutor(FactCoreProperties properties) {
    var facts = properties.facts();
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(facts.flushCorePoolSize());
    executor.setMaxPoolSize(facts.flushMaxPoolSize());
    executor.setQueueCapacity(facts.flushQueueCapacity());
    executor.setThreadNamePrefix("fact-flush-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();

    log.info(
        "Fact flush executor configured: core={}, max={}, queue={}",
        executor.getCorePoolSize(),
        executor.getMaxPoolSize(),
        facts.flushQueueCapacity());
    return executor;
  }
}
