package io.buildunion.factcore.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Tunables for the facts core, bound from the {@code buildunion.*} namespace. */
@ConfigurationProperties(prefix = "buildunion")
public record FactCoreProperties(Facts facts, Cache cache, Sessions sessions, Weather weather) {

  public FactCoreProperties {
    facts = facts != null ? facts : new Facts(3, 2, 8, 200);
    cache = cache != null ? cache : new Cache(5_000, Duration.ofHours(12));
    sessions = sessions != null ? sessions : new Sessions(Duration.ofMinutes(30));
    weather = weather != null ? weather : new Weather(false, "", 3);
  }

  /** Background flush of synthesized citations. */
  public record Facts(
      int flushRetries, int flushCorePoolSize, int flushMaxPoolSize, int flushQueueCapacity) {}

  /** Device-local snapshot cache consulted when the primary store is empty or unavailable. */
  public record Cache(long maximumSize, Duration ttl) {}

  public record Sessions(Duration idleTimeout) {}

  public record Weather(boolean enabled, String baseUrl, int forecastDays) {}
}
