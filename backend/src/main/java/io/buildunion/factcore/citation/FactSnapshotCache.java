package io.buildunion.factcore.citation;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Secondary, local copy of each project's last successfully read citation records. Consulted only
 * when the primary store returns nothing or fails.
 */
public interface FactSnapshotCache {

  void put(UUID projectId, List<Map<String, Object>> records);

  Optional<List<Map<String, Object>>> get(UUID projectId);

  void evict(UUID projectId);
}
