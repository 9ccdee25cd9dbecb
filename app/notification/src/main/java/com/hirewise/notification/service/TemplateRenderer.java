/*
 * Where: Notification service layer
 * What: Renders the active template for (type, delivery method) with {placeholder} values
 * Why: A missing or broken template must never stop a notification from being created
 */
package com.hirewise.notification.service;

import com.hirewise.notification.model.DeliveryMethod;
import com.hirewise.notification.model.NotificationTemplateRecord;
import com.hirewise.notification.repository.NotificationTemplateRepository;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TemplateRenderer {

  private static final Logger logger = LoggerFactory.getLogger(TemplateRenderer.class);
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_]+)}");

  private final NotificationTemplateRepository templateRepository;

  public RenderedContent render(
      String notificationType,
      DeliveryMethod deliveryMethod,
      Map<String, ?> context,
      String fallbackTitle,
      String fallbackMessage) {
    final Optional<NotificationTemplateRecord> template;
    try {
      template = templateRepository.findActive(notificationType, deliveryMethod.templateChannel());
    } catch (DataAccessException ex) {
      logger.warn(
          "template lookup failed, using literal content type={} method={}",
          notificationType,
          deliveryMethod.value(),
          ex);
      return RenderedContent.literal(fallbackTitle, fallbackMessage);
    }
    if (template.isEmpty()) {
      return RenderedContent.literal(fallbackTitle, fallbackMessage);
    }
    final NotificationTemplateRecord found = template.get();
    try {
      return new RenderedContent(
          substitute(found.titleTemplate(), context),
          substitute(found.messageTemplate(), context),
          found.templateId());
    } catch (UnresolvedPlaceholderException ex) {
      logger.warn(
          "template placeholder unresolved, using literal content templateId={} placeholder={}",
          found.templateId(),
          ex.placeholder());
      return RenderedContent.literal(fallbackTitle, fallbackMessage);
    }
  }

  static String substitute(String template, Map<String, ?> context) {
    final Matcher matcher = PLACEHOLDER.matcher(template);
    final StringBuilder rendered = new StringBuilder();
    while (matcher.find()) {
      final String name = matcher.group(1);
      if (context == null || !context.containsKey(name) || context.get(name) == null) {
        throw new UnresolvedPlaceholderException(name);
      }
      matcher.appendReplacement(rendered, Matcher.quoteReplacement(format(context.get(name))));
    }
    matcher.appendTail(rendered);
    return rendered.toString();
  }

  private static String format(Object value) {
    if (value instanceof Collection<?> values) {
      return values.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }
    return String.valueOf(value);
  }

  private static final class UnresolvedPlaceholderException extends RuntimeException {
    private final String placeholder;

    private UnresolvedPlaceholderException(String placeholder) {
      super("unresolved placeholder " + placeholder, null, false, false);
      this.placeholder = placeholder;
    }

    private String placeholder() {
      return placeholder;
    }
  }
}
