package io.buildunion.factcore.integration.email;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

/**
 * Renders notification emails from Thymeleaf classpath templates under {@code templates/email/}.
 * The content template is rendered first and then placed into the shared {@code base} layout.
 */
@Service
public class EmailTemplateRenderer {

  private static final Logger log = LoggerFactory.getLogger(EmailTemplateRenderer.class);

  private final TemplateEngine emailTemplateEngine;

  public EmailTemplateRenderer() {
    this.emailTemplateEngine = createEmailTemplateEngine();
  }

  public RenderedEmail render(EmailTemplateData templateData) {
    var ctx = new Context();
    templateData.variables().forEach(ctx::setVariable);
    ctx.setVariable("subject", templateData.subject());

    String contentHtml = emailTemplateEngine.process(templateData.template(), ctx);
    ctx.setVariable("contentHtml", contentHtml);
    String fullHtml = emailTemplateEngine.process("base", ctx);

    log.debug(
        "Rendered email template '{}', HTML size={}", templateData.template(), fullHtml.length());
    return new RenderedEmail(templateData.subject(), fullHtml, toPlainText(fullHtml));
  }

  /** Strips tags and decodes common entities, keeping line structure. */
  String toPlainText(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }
    String text = html;
    text = text.replaceAll("(?is)<head>.*?</head>", "");
    text = text.replaceAll("<br\\s*/?>", "\n");
    text = text.replaceAll("</p>", "\n\n");
    text = text.replaceAll("</(div|tr|li|h1|h2)>", "\n");
    text = text.replaceAll("</td>", " ");
    text = text.replaceAll("<[^>]+>", "");
    text = text.replace("&amp;", "&");
    text = text.replace("&lt;", "<");
    text = text.replace("&gt;", ">");
    text = text.replace("&quot;", "\"");
    text = text.replace("&nbsp;", " ");
    text = text.replace("&#39;", "'");
    text = text.replaceAll("[ \\t]+", " ");
    text = text.replaceAll("(?m)^ +| +$", "");
    text = text.replaceAll("\\n{3,}", "\n\n");
    return text.strip();
  }

  private static TemplateEngine createEmailTemplateEngine() {
    var engine = new TemplateEngine();
    var resolver = new ClassLoaderTemplateResolver();
    resolver.setPrefix("templates/email/");
    resolver.setSuffix(".html");
    resolver.setTemplateMode(TemplateMode.HTML);
    resolver.setCharacterEncoding("UTF-8");
    resolver.setCacheable(true);
    engine.setTemplateResolver(resolver);
    return engine;
  }
}
