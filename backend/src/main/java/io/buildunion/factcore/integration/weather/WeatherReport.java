package io.buildunion.factcore.integration.weather;

import java.util.List;
import java.util.Map;

/** Current conditions, daily forecast and active alerts for one address. */
public record WeatherReport(
    Map<String, Object> current, List<Map<String, Object>> forecast, List<WeatherAlert> alerts) {

  public WeatherReport {
    current = current != null ? current : Map.of();
    forecast = forecast != null ? forecast : List.of();
    alerts = alerts != null ? alerts : List.of();
  }

  public boolean hasAlerts() {
    return !alerts.isEmpty();
  }
}
