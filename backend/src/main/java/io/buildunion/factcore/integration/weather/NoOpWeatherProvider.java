package io.buildunion.factcore.integration.weather;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Used when no weather endpoint is configured. Never produces a report. */
@Component
@ConditionalOnProperty(
    prefix = "buildunion.weather",
    name = "enabled",
    havingValue = "false",
    matchIfMissing = true)
public class NoOpWeatherProvider implements WeatherProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpWeatherProvider.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public Optional<WeatherReport> fetch(String address, int days) {
    log.debug("NoOp weather: would fetch {} day(s) for '{}'", days, address);
    return Optional.empty();
  }
}
