package io.buildunion.factcore.projectload;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.buildunion.factcore.config.FactCoreProperties;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Component;

/** Open project sessions, expired after a period without access. */
@Component
public class ProjectSessionRegistry {

  // sessionId -> session
  private final Cache<UUID, ProjectSession> sessions;

  public ProjectSessionRegistry(FactCoreProperties properties) {
    this.sessions =
        Caffeine.newBuilder()
            .expireAfterAccess(properties.sessions().idleTimeout())
            .maximumSize(10_000)
            .build();
  }

  public void register(ProjectSession session) {
    sessions.put(session.sessionId(), session);
  }

  public Optional<ProjectSession> find(UUID sessionId) {
    return Optional.ofNullable(sessions.getIfPresent(sessionId));
  }

  public List<ProjectSession> forProject(UUID projectId) {
    return sessions.asMap().values().stream()
        .filter(s -> s.projectId().equals(projectId))
        .toList();
  }

  public void close(UUID sessionId) {
    sessions.invalidate(sessionId);
  }
}
