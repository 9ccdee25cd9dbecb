/*
 * Where: Notification domain model
 * What: Per-recipient gates, per-type delivery overrides and the default method
 * Why: Gating and delivery resolution read one snapshot per recipient
 */
package com.hirewise.notification.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record NotificationPreferenceRecord(
    String recipientId,
    Map<KnownNotificationType, Boolean> gates,
    DeliveryMethod defaultDeliveryMethod,
    Map<String, DeliveryMethod> deliveryOverrides,
    Instant createdAt,
    Instant updatedAt) {

  public NotificationPreferenceRecord {
    final Map<KnownNotificationType, Boolean> copiedGates = new EnumMap<>(KnownNotificationType.class);
    if (gates != null) {
      copiedGates.putAll(gates);
    }
    gates = Collections.unmodifiableMap(copiedGates);
    deliveryOverrides =
        deliveryOverrides == null ? Map.of() : Collections.unmodifiableMap(Map.copyOf(deliveryOverrides));
    defaultDeliveryMethod =
        defaultDeliveryMethod == null ? DeliveryMethod.WEBSOCKET : defaultDeliveryMethod;
  }

  /** All gates open; status and interview updates go out over both channels. */
  public static NotificationPreferenceRecord defaults(String recipientId, Instant now) {
    final Map<KnownNotificationType, Boolean> gates = new EnumMap<>(KnownNotificationType.class);
    for (KnownNotificationType type : KnownNotificationType.values()) {
      gates.put(type, true);
    }
    return new NotificationPreferenceRecord(
        recipientId,
        gates,
        DeliveryMethod.WEBSOCKET,
        Map.of(
            KnownNotificationType.APPLICATION_STATUS_CHANGED.value(), DeliveryMethod.BOTH,
            KnownNotificationType.INTERVIEW_SCHEDULED.value(), DeliveryMethod.BOTH),
        now,
        now);
  }

  /** Unknown types are never gated. */
  public boolean isEnabled(String notificationType) {
    return KnownNotificationType.find(notificationType)
        .map(type -> gates.getOrDefault(type, Boolean.TRUE))
        .orElse(Boolean.TRUE);
  }

  public DeliveryMethod deliveryMethodFor(String notificationType) {
    final DeliveryMethod override = deliveryOverrides.get(notificationType);
    return override == null ? defaultDeliveryMethod : override;
  }
}
