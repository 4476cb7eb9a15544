package io.buildunion.factcore.citation.synthesis;

import io.buildunion.factcore.integration.weather.WeatherReport;
import java.util.Optional;

@FunctionalInterface
public interface WeatherLookup {

  WeatherLookup NONE = address -> Optional.empty();

  Optional<WeatherReport> lookup(String address);
}
