package com.hirewise.notification.model.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** notification_type is null when every type was acknowledged. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BulkReadAcknowledgmentEvent(String notificationType, int count, Instant timestamp)
    implements PushEvent {

  public static final String TYPE = "bulk_read_acknowledgment";

  @Override
  public String type() {
    return TYPE;
  }
}
