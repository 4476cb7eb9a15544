package io.buildunion.factcore.integration.weather;

import java.util.Optional;

/** Port for site weather lookups. */
public interface WeatherProvider {

  /** Provider identifier (e.g., "http", "noop"). */
  String providerId();

  /**
   * Fetches conditions for an address. Returns empty when the provider has nothing for it; throws
   * when the upstream call fails.
   */
  Optional<WeatherReport> fetch(String address, int days);
}
