package com.hirewise.notification.service;

import com.hirewise.notification.model.NotificationRecord;
import java.util.List;

/** unreadCount ignores the listing filters; totalCount honours them. */
public record NotificationPage(
    List<NotificationRecord> notifications,
    int totalCount,
    int unreadCount,
    int limit,
    int offset) {

  public NotificationPage {
    notifications = List.copyOf(notifications);
  }

  public boolean hasMore() {
    return offset + limit < totalCount;
  }
}
