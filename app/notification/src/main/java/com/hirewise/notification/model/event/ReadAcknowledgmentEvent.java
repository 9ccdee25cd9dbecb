package com.hirewise.notification.model.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReadAcknowledgmentEvent(UUID notificationId, Instant readAt, Instant timestamp)
    implements PushEvent {

  public static final String TYPE = "notification_read_acknowledgment";

  @Override
  public String type() {
    return TYPE;
  }
}
