package com.hirewise.notification.model.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** Published by the connection gateway when a user's first session opens or last one closes. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PresenceEvent(String userId, String status, Instant occurredAt) {

  public static final String CONNECTED = "connected";
  public static final String DISCONNECTED = "disconnected";

  public boolean isConnected() {
    return CONNECTED.equalsIgnoreCase(status);
  }
}
