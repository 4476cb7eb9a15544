package io.buildunion.factcore.integration.weather;

import io.buildunion.factcore.config.FactCoreProperties;
import io.buildunion.factcore.exception.ExternalServiceDegradedException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class WeatherService {

  private static final Logger log = LoggerFactory.getLogger(WeatherService.class);

  private final WeatherProvider weatherProvider;
  private final int forecastDays;

  public WeatherService(WeatherProvider weatherProvider, FactCoreProperties properties) {
    this.weatherProvider = weatherProvider;
    this.forecastDays = Math.max(1, properties.weather().forecastDays());
  }

  /** Best-effort lookup used during synthesis: any failure is logged and yields empty. */
  public Optional<WeatherReport> tryFetch(String address) {
    if (address == null || address.isBlank()) {
      return Optional.empty();
    }
    try {
      return weatherProvider.fetch(address, forecastDays);
    } catch (RuntimeException e) {
      log.warn(
          "Weather lookup via {} failed for '{}'", weatherProvider.providerId(), address, e);
      return Optional.empty();
    }
  }

  /**
   * Lookup on behalf of a caller that must be told about failures.
   *
   * @throws ExternalServiceDegradedException if the provider fails or has no report
   */
  public WeatherReport fetch(String address) {
    try {
      return weatherProvider
          .fetch(address, forecastDays)
          .orElseThrow(
              () ->
                  new ExternalServiceDegradedException(
                      "Weather", "No weather report available for the project address", null));
    } catch (ExternalServiceDegradedException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ExternalServiceDegradedException("Weather", "Weather lookup failed", e);
    }
  }
}
