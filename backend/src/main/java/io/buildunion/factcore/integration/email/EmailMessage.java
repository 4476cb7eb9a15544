package io.buildunion.factcore.integration.email;

import java.util.Objects;

/** Provider-agnostic email payload with an HTML body and its plain-text fallback. */
public record EmailMessage(String to, String subject, String htmlBody, String plainTextBody) {

  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
  }

  public static EmailMessage of(String to, RenderedEmail rendered) {
    return new EmailMessage(to, rendered.subject(), rendered.htmlBody(), rendered.plainTextBody());
  }
}
