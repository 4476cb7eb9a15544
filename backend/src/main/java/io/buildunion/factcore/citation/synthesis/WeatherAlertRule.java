package io.buildunion.factcore.citation.synthesis;

import io.buildunion.factcore.citation.Citation;
import io.buildunion.factcore.citation.CiteType;
import io.buildunion.factcore.citation.LedgerSnapshot;
import io.buildunion.factcore.integration.weather.WeatherAlert;
import io.buildunion.factcore.integration.weather.WeatherReport;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives WEATHER_ALERT from a live lookup for the site address. The lookup is skipped entirely
 * when the ledger already has the citation.
 */
final class WeatherAlertRule implements SynthesisRule {

  @Override
  public String name() {
    return "weather-alert";
  }

  @Override
  public List<Citation> candidates(LedgerSnapshot snapshot, SynthesisContext context) {
    if (snapshot.findFirst(CiteType.WEATHER_ALERT).isPresent()) {
      return List.of();
    }
    String address =
        snapshot
            .findFirst(CiteType.LOCATION)
            .map(Citation::answer)
            .filter(answer -> !answer.isBlank())
            .orElse(context.projectAddress());
    if (address == null || address.isBlank()) {
      return List.of();
    }
    return context
        .weather()
        .lookup(address)
        .map(report -> List.of(toCitation(address, report, context)))
        .orElse(List.of());
  }

  private static Citation toCitation(
      String address, WeatherReport report, SynthesisContext context) {
    var alerts = report.alerts().stream().map(WeatherAlertRule::alertRecord).toList();
    String answer =
        report.hasAlerts()
            ? report.alerts().get(0).event()
                + (alerts.size() > 1 ? " (+" + (alerts.size() - 1) + " more)" : "")
            : "No active weather alerts";

    var value = new LinkedHashMap<String, Object>();
    value.put("alerts", alerts);
    value.put("current", report.current());

    var metadata = new LinkedHashMap<String, Object>();
    metadata.put("address", address);
    metadata.put("alert_count", alerts.size());
    metadata.put("fetched_at", context.now().toString());
    return SyntheticCitations.create(
        CiteType.WEATHER_ALERT, "site", answer, value, metadata, context.now());
  }

  private static Map<String, Object> alertRecord(WeatherAlert alert) {
    var record = new LinkedHashMap<String, Object>();
    record.put("event", alert.event());
    record.put("severity", alert.severity());
    record.put("description", alert.description());
    record.put("start", alert.start());
    record.put("end", alert.end());
    return record;
  }
}
