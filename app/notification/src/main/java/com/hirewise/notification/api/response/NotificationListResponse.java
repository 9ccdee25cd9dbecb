package com.hirewise.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationListResponse(
    List<NotificationItemResponse> notifications,
    int totalCount,
    int unreadCount,
    boolean hasMore,
    int limit,
    int offset) {

  public NotificationListResponse {
    notifications = List.copyOf(notifications);
  }
}
