/*
 * Where: Notification domain model
 * What: Snapshot of a notifications row
 * Why: Shared by the service, the router, listing and the API
 */
package com.hirewise.notification.model;

import com.hirewise.notification.model.payload.NotificationPayload;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

public record NotificationRecord(
    UUID notificationId,
    String recipientId,
    String notificationType,
    String title,
    String message,
    NotificationPayload payload,
    NotificationPriority priority,
    boolean read,
    boolean sent,
    Instant createdAt,
    Instant readAt,
    Instant sentAt,
    Instant expiresAt) {

  /** Width of notifications.title and notification_templates.title_template. */
  public static final int TITLE_MAX_LENGTH = 255;

  public static NotificationRecord unread(
      UUID notificationId,
      String recipientId,
      String notificationType,
      String title,
      String message,
      NotificationPayload payload,
      NotificationPriority priority,
      Instant createdAt,
      Instant expiresAt) {
    return new NotificationRecord(
        notificationId,
        recipientId,
        notificationType,
        title,
        message,
        payload,
        priority,
        false,
        false,
        createdAt,
        null,
        null,
        expiresAt);
  }

  public boolean isExpired(Instant now) {
    return expiresAt != null && now.isAfter(expiresAt);
  }

  public double ageInHours(Instant now) {
    return Duration.between(createdAt, now).toSeconds() / 3600.0d;
  }
}
