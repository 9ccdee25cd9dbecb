package com.hirewise.notification.service;

import com.google.common.base.Ascii;
import com.hirewise.notification.model.NotificationRecord;
import java.util.UUID;

/**
 * templateId is null when the literal title and message were used. Titles longer than the
 * notifications.title column are cut with a trailing ellipsis.
 */
public record RenderedContent(String title, String message, UUID templateId) {

  static final String TRUNCATION_MARK = "...";

  public RenderedContent {
    if (title != null) {
      title = Ascii.truncate(title, NotificationRecord.TITLE_MAX_LENGTH, TRUNCATION_MARK);
    }
  }

  public static RenderedContent literal(String title, String message) {
    return new RenderedContent(title, message, null);
  }

  public boolean fromTemplate() {
    return templateId != null;
  }
}
