package io.buildunion.factcore.integration.email;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sends one templated email to each recipient. Recipients are independent: a failure for one is
 * recorded in its result and does not stop the others.
 */
@Service
public class NotificationEmailService {

  private static final Logger log = LoggerFactory.getLogger(NotificationEmailService.class);

  private final EmailProvider emailProvider;
  private final EmailTemplateRenderer templateRenderer;

  public NotificationEmailService(
      EmailProvider emailProvider, EmailTemplateRenderer templateRenderer) {
    this.emailProvider = emailProvider;
    this.templateRenderer = templateRenderer;
  }

  /** Returns the send result per recipient, in recipient order. */
  public Map<String, SendResult> send(List<String> recipients, EmailTemplateData templateData) {
    var results = new LinkedHashMap<String, SendResult>();
    var rendered = templateRenderer.render(templateData);
    for (String recipient : recipients) {
      if (recipient == null || recipient.isBlank()) {
        continue;
      }
      results.put(recipient, sendOne(EmailMessage.of(recipient, rendered)));
    }
    long failed = results.values().stream().filter(r -> !r.success()).count();
    if (failed > 0) {
      log.warn(
          "Email '{}' failed for {} of {} recipient(s)",
          templateData.template(),
          failed,
          results.size());
    }
    return results;
  }

  private SendResult sendOne(EmailMessage message) {
    try {
      return emailProvider.sendEmail(message);
    } catch (RuntimeException e) {
      log.warn("Email via {} to {} failed", emailProvider.providerId(), message.to(), e);
      return new SendResult(false, null, e.getMessage());
    }
  }
}
