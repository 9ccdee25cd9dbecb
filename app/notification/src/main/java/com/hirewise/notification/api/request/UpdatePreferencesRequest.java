package com.hirewise.notification.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.hirewise.notification.model.DeliveryMethod;
import com.hirewise.notification.model.KnownNotificationType;
import com.hirewise.notification.service.PreferenceUpdate;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/** Keys of enabled_types are notification types; omitted keys keep their current value. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "request DTO is read once and converted immediately")
public record UpdatePreferencesRequest(
    Map<String, Boolean> enabledTypes,
    String defaultDeliveryMethod,
    Map<String, String> deliveryOverrides) {

  /**
   * @throws IllegalArgumentException for an unknown gate type or delivery method
   */
  public PreferenceUpdate toUpdate() {
    final Map<KnownNotificationType, Boolean> gates = new EnumMap<>(KnownNotificationType.class);
    if (enabledTypes != null) {
      enabledTypes.forEach(
          (type, enabled) -> {
            final KnownNotificationType known =
                KnownNotificationType.find(type)
                    .orElseThrow(
                        () -> new IllegalArgumentException("unknown notification type: " + type));
            if (enabled == null) {
              throw new IllegalArgumentException("enabled flag is required for " + type);
            }
            gates.put(known, enabled);
          });
    }
    final Map<String, DeliveryMethod> overrides = new LinkedHashMap<>();
    if (deliveryOverrides != null) {
      deliveryOverrides.forEach((type, method) -> overrides.put(type, DeliveryMethod.fromValue(method)));
    }
    return new PreferenceUpdate(
        gates,
        defaultDeliveryMethod == null ? null : DeliveryMethod.fromValue(defaultDeliveryMethod),
        overrides);
  }
}
