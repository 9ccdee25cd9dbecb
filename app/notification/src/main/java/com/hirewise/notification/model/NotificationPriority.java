/*
 * Where: Notification domain model
 * What: Priority levels with their listing rank
 * Why: Listing sorts by rank before recency
 */
package com.hirewise.notification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationPriority {
  LOW("low", 1),
  NORMAL("normal", 2),
  HIGH("high", 3),
  URGENT("urgent", 4);

  private final String value;
  private final int rank;

  NotificationPriority(String value, int rank) {
    this.value = value;
    this.rank = rank;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public int rank() {
    return rank;
  }

  /**
   * Parses the lower-case wire value, ignoring case. A null or blank value means {@link #NORMAL};
   * anything else unknown is rejected with IllegalArgumentException.
   */
  @JsonCreator
  public static NotificationPriority fromValue(String value) {
    if (value == null || value.isBlank()) {
      return NORMAL;
    }
    for (NotificationPriority priority : values()) {
      if (priority.value.equalsIgnoreCase(value.trim())) {
        return priority;
      }
    }
    throw new IllegalArgumentException("unsupported priority: " + value);
  }
}
