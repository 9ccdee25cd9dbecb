package com.hirewise.notification.service;

import com.hirewise.notification.model.DeliveryMethod;
import com.hirewise.notification.model.KnownNotificationType;
import java.util.Map;

/** Partial preference change; null or absent entries keep the stored value. */
public record PreferenceUpdate(
    Map<KnownNotificationType, Boolean> gates,
    DeliveryMethod defaultDeliveryMethod,
    Map<String, DeliveryMethod> deliveryOverrides) {

  public PreferenceUpdate {
    gates = gates == null ? Map.of() : Map.copyOf(gates);
    deliveryOverrides = deliveryOverrides == null ? Map.of() : Map.copyOf(deliveryOverrides);
  }
}
