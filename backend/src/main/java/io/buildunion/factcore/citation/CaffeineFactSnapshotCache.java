package io.buildunion.factcore.citation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.buildunion.factcore.config.FactCoreProperties;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
public class CaffeineFactSnapshotCache implements FactSnapshotCache {

  // projectId -> records of the last successful primary read
  private final Cache<UUID, List<Map<String, Object>>> snapshots;

  public CaffeineFactSnapshotCache(FactCoreProperties properties) {
    this.snapshots =
        Caffeine.newBuilder()
            .maximumSize(properties.cache().maximumSize())
            .expireAfterWrite(properties.cache().ttl())
            .build();
  }

  @Override
  public void put(UUID projectId, List<Map<String, Object>> records) {
    snapshots.put(projectId, Collections.unmodifiableList(new ArrayList<>(records)));
  }

  @Override
  public Optional<List<Map<String, Object>>> get(UUID projectId) {
    return Optional.ofNullable(snapshots.getIfPresent(projectId));
  }

  @Override
  public void evict(UUID projectId) {
    snapshots.invalidate(projectId);
  }
}
