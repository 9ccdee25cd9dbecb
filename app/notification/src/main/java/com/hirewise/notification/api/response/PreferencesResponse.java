package com.hirewise.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.hirewise.notification.model.KnownNotificationType;
import com.hirewise.notification.model.NotificationPreferenceRecord;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PreferencesResponse(
    String recipientId,
    Map<String, Boolean> enabledTypes,
    String defaultDeliveryMethod,
    Map<String, String> deliveryOverrides,
    Instant updatedAt) {

  public PreferencesResponse {
    enabledTypes = Map.copyOf(enabledTypes);
    deliveryOverrides = Map.copyOf(deliveryOverrides);
  }

  public static PreferencesResponse from(NotificationPreferenceRecord record) {
    final Map<String, Boolean> enabled = new LinkedHashMap<>();
    for (KnownNotificationType type : KnownNotificationType.values()) {
      enabled.put(type.value(), record.isEnabled(type.value()));
    }
    final Map<String, String> overrides = new LinkedHashMap<>();
    record.deliveryOverrides().forEach((type, method) -> overrides.put(type, method.value()));
    return new PreferencesResponse(
        record.recipientId(),
        enabled,
        record.defaultDeliveryMethod().value(),
        overrides,
        record.updatedAt());
  }
}
