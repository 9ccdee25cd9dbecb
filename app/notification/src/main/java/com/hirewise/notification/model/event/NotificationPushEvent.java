/*
 * Where: Push channel contract
 * What: A notification delivered live or replayed from the offline backlog
 * Why: Replayed events carry queued/queued_at/delivered_at so clients can tell them apart
 */
package com.hirewise.notification.model.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.hirewise.notification.model.NotificationPriority;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@SuppressFBWarnings(
    value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
    justification = "data is a Jackson tree that is serialized immediately and never mutated")
public record NotificationPushEvent(
    UUID notificationId,
    String notificationType,
    String title,
    String message,
    JsonNode data,
    NotificationPriority priority,
    Instant timestamp,
    Boolean queued,
    Instant queuedAt,
    Instant deliveredAt)
    implements PushEvent {

  public static final String TYPE = "notification";

  public static NotificationPushEvent live(
      UUID notificationId,
      String notificationType,
      String title,
      String message,
      JsonNode data,
      NotificationPriority priority,
      Instant timestamp) {
    return new NotificationPushEvent(
        notificationId, notificationType, title, message, data, priority, timestamp, null, null, null);
  }

  public static NotificationPushEvent replayed(
      UUID notificationId,
      String notificationType,
      String title,
      String message,
      JsonNode data,
      NotificationPriority priority,
      Instant queuedAt,
      Instant deliveredAt) {
    return new NotificationPushEvent(
        notificationId,
        notificationType,
        title,
        message,
        data,
        priority,
        deliveredAt,
        Boolean.TRUE,
        queuedAt,
        deliveredAt);
  }

  @Override
  public String type() {
    return TYPE;
  }
}
