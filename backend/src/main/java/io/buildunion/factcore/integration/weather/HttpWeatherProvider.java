package io.buildunion.factcore.integration.weather;

import io.buildunion.factcore.config.FactCoreProperties;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Weather adapter backed by an HTTP forecast endpoint returning {@link WeatherReport} JSON for
 * {@code GET /forecast?address=...&days=...}.
 */
@Component
@ConditionalOnProperty(prefix = "buildunion.weather", name = "enabled", havingValue = "true")
public class HttpWeatherProvider implements WeatherProvider {

  private static final Logger log = LoggerFactory.getLogger(HttpWeatherProvider.class);

  private final RestClient restClient;

  public HttpWeatherProvider(FactCoreProperties properties) {
    this.restClient = RestClient.builder().baseUrl(properties.weather().baseUrl()).build();
  }

  @Override
  public String providerId() {
    return "http";
  }

  @Override
  public Optional<WeatherReport> fetch(String address, int days) {
    log.debug("Fetching {} day(s) of weather for '{}'", days, address);
    var report =
        restClient
            .get()
            .uri(
                uriBuilder ->
                    uriBuilder
                        .path("/forecast")
                        .queryParam("address", address)
                        .queryParam("days", days)
                        .build())
            .retrieve()
            .body(WeatherReport.class);
    return Optional.ofNullable(report);
  }
}
