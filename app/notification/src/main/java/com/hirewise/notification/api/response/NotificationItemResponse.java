/*
 * Where: Notification API response DTO
 * What: One notification as returned by listing and create
 * Why: is_expired and age_in_hours are derived at read time
 */
package com.hirewise.notification.api.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.hirewise.notification.model.NotificationPriority;
import com.hirewise.notification.model.NotificationRecord;
import com.hirewise.notification.model.payload.NotificationPayload;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationItemResponse(
    UUID notificationId,
    String notificationType,
    String title,
    String message,
    NotificationPayload data,
    NotificationPriority priority,
    @JsonProperty("is_read") boolean read,
    @JsonProperty("is_sent") boolean sent,
    Instant createdAt,
    Instant readAt,
    Instant sentAt,
    Instant expiresAt,
    @JsonProperty("is_expired") boolean expired,
    double ageInHours) {

  public static NotificationItemResponse from(NotificationRecord record, Instant now) {
    return new NotificationItemResponse(
        record.notificationId(),
        record.notificationType(),
        record.title(),
        record.message(),
        record.payload(),
        record.priority(),
        record.read(),
        record.sent(),
        record.createdAt(),
        record.readAt(),
        record.sentAt(),
        record.expiresAt(),
        record.isExpired(now),
        Math.round(record.ageInHours(now) * 100.0d) / 100.0d);
  }
}
