/*
 * Where: Notification service layer
 * What: Result of creating one notification
 * Why: Preference suppression and recipient misses are expected policy results, not errors
 */
package com.hirewise.notification.service;

import com.hirewise.notification.model.DeliveryMethod;
import com.hirewise.notification.model.NotificationRecord;

public sealed interface CreateOutcome
    permits CreateOutcome.Created, CreateOutcome.Suppressed, CreateOutcome.Failed {

  enum SuppressionReason {
    PREFERENCE_DISABLED
  }

  enum FailureReason {
    RECIPIENT_NOT_FOUND,
    DIRECTORY_UNAVAILABLE,
    PERSISTENCE_FAILURE,
    INVALID_REQUEST
  }

  record Created(NotificationRecord notification, DeliveryMethod deliveryMethod)
      implements CreateOutcome {}

  record Suppressed(String recipientId, String notificationType, SuppressionReason reason)
      implements CreateOutcome {}

  record Failed(String recipientId, FailureReason reason, String message)
      implements CreateOutcome {}
}
