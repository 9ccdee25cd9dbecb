/*
 * Where: Notification domain model
 * What: Notification types that carry a preference gate and a typed payload
 * Why: notification_type is open-ended on the wire; these are the ones the engine knows
 */
package com.hirewise.notification.model;

import java.util.Optional;

public enum KnownNotificationType {
  JOB_POSTED("job_posted"),
  APPLICATION_RECEIVED("application_received"),
  APPLICATION_STATUS_CHANGED("application_status_changed"),
  MATCH_SCORE_CALCULATED("match_score_calculated"),
  INTERVIEW_SCHEDULED("interview_scheduled"),
  MESSAGE_RECEIVED("message_received"),
  SYSTEM_UPDATE("system_update");

  private final String value;

  KnownNotificationType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static Optional<KnownNotificationType> find(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (KnownNotificationType type : values()) {
      if (type.value.equals(value)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
