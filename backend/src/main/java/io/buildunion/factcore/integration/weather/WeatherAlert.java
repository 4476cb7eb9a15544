package io.buildunion.factcore.integration.weather;

/** An active weather warning for a site address. Times are ISO-8601 strings as sent upstream. */
public record WeatherAlert(
    String event, String severity, String description, String start, String end) {}
