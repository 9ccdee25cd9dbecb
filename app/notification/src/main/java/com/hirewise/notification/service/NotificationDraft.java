/*
 * Where: Notification service layer
 * What: Recipient-independent content of a notification to create
 * Why: Single and bulk creation share the same fields and validation
 */
package com.hirewise.notification.service;

import com.hirewise.notification.model.NotificationPriority;
import com.hirewise.notification.model.payload.NotificationPayload;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record NotificationDraft(
    String notificationType,
    String title,
    String message,
    NotificationPayload payload,
    NotificationPriority priority,
    Instant expiresAt,
    boolean sendRealTime,
    Map<String, Object> templateContext) {

  public NotificationDraft {
    priority = priority == null ? NotificationPriority.NORMAL : priority;
    templateContext =
        templateContext == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(templateContext));
  }

  public static NotificationDraft of(String notificationType, String title, String message) {
    return new NotificationDraft(
        notificationType, title, message, null, NotificationPriority.NORMAL, null, true, Map.of());
  }
}
