package com.hirewise.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BulkCreateNotificationResponse(
    int createdCount,
    List<UUID> notificationIds,
    List<String> suppressedRecipientIds,
    List<String> unknownRecipientIds) {

  public BulkCreateNotificationResponse {
    notificationIds = List.copyOf(notificationIds);
    suppressedRecipientIds = List.copyOf(suppressedRecipientIds);
    unknownRecipientIds = List.copyOf(unknownRecipientIds);
  }
}
