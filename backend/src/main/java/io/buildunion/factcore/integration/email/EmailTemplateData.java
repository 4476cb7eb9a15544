package io.buildunion.factcore.integration.email;

import java.util.Map;

/** Template name, subject line and variables of a notification email. */
public record EmailTemplateData(String template, String subject, Map<String, Object> variables) {

  public EmailTemplateData {
    variables = variables != null ? Map.copyOf(variables) : Map.of();
  }
}
