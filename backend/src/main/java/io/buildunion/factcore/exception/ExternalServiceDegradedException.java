package io.buildunion.factcore.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when an external collaborator (AI analysis, weather, email) fails or times out. Results in
 * HTTP 503; the facts ledger is never affected by the failure.
 */
public class ExternalServiceDegradedException extends ErrorResponseException {

  public ExternalServiceDegradedException(String service, String detail, Throwable cause) {
    super(
        HttpStatus.SERVICE_UNAVAILABLE,
        Problems.of(
            HttpStatus.SERVICE_UNAVAILABLE,
            Problems.EXTERNAL_SERVICE_DEGRADED,
            service + " unavailable",
            detail),
        cause);
    getBody().setProperty("service", service);
  }
}
