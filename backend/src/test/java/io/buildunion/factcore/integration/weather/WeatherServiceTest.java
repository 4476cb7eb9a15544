package io.buildunion.factcore.integration.weather;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.buildunion.factcore.config.FactCoreProperties;
import io.buildunion.factcore.exception.ExternalServiceDegradedException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class WeatherServiceTest {

  private static final FactCoreProperties PROPERTIES =
      new FactCoreProperties(
          null, null, null, new FactCoreProperties.Weather(true, "http://weather.local", 5));

  private static final WeatherReport REPORT =
      new WeatherReport(
          Map.of("temp_c", 8),
          List.of(),
          List.of(new WeatherAlert("Rainfall Warning", "moderate", "50 mm", null, null)));

  @Test
  void tryFetchPassesConfiguredForecastDays() {
    var service =
        new WeatherService(provider((address, days) -> days == 5 ? REPORT : null), PROPERTIES);

    assertThat(service.tryFetch("1 Front St")).contains(REPORT);
  }

  @Test
  void tryFetchSwallowsProviderFailure() {
    var service =
        new WeatherService(
            provider(
                (address, days) -> {
                  throw new IllegalStateException("upstream 502");
                }),
            PROPERTIES);

    assertThat(service.tryFetch("1 Front St")).isEmpty();
  }

  @Test
  void tryFetchSkipsBlankAddress() {
    var service = new WeatherService(new NoOpWeatherProvider(), PROPERTIES);

    assertThat(service.tryFetch(" ")).isEmpty();
  }

  @Test
  void fetchReportsFailureToCaller() {
    var service =
        new WeatherService(
            provider(
                (address, days) -> {
                  throw new IllegalStateException("upstream 502");
                }),
            PROPERTIES);

    assertThatThrownBy(() -> service.fetch("1 Front St"))
        .isInstanceOf(ExternalServiceDegradedException.class);
  }

  @Test
  void fetchWithoutReportIsDegraded() {
    var service = new WeatherService(new NoOpWeatherProvider(), PROPERTIES);

    assertThatThrownBy(() -> service.fetch("1 Front St"))
        .isInstanceOf(ExternalServiceDegradedException.class);
  }

  private static WeatherProvider provider(ReportSource source) {
    return new WeatherProvider() {
      @Override
      public String providerId() {
        return "test";
      }

      @Override
      public Optional<WeatherReport> fetch(String address, int days) {
        return Optional.ofNullable(source.report(address, days));
      }
    };
  }

  @FunctionalInterface
  private interface ReportSource {
    WeatherReport report(String address, int days);
  }
}
