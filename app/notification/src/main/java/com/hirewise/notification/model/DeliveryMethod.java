/*
 * Where: Notification domain model
 * What: Channels a notification may be delivered through
 * Why: The router and the template lookup both key on it
 */
package com.hirewise.notification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Set;

public enum DeliveryMethod {
  WEBSOCKET("websocket"),
  EMAIL("email"),
  PUSH("push"),
  BOTH("both");

  private final String value;

  DeliveryMethod(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** True when the method asks for live delivery over the per-user push channel. */
  public boolean includesLiveChannel() {
    return this == WEBSOCKET || this == BOTH;
  }

  /** External transports to signal; {@code both} means websocket plus email. */
  public Set<DeliveryMethod> externalChannels() {
    return switch (this) {
      case EMAIL, BOTH -> EnumSet.of(EMAIL);
      case PUSH -> EnumSet.of(PUSH);
      case WEBSOCKET -> EnumSet.noneOf(DeliveryMethod.class);
    };
  }

  /** Method whose template renders the in-app title/message. */
  public DeliveryMethod templateChannel() {
    return this == BOTH ? WEBSOCKET : this;
  }

  @JsonCreator
  public static DeliveryMethod fromValue(String value) {
    if (value != null) {
      for (DeliveryMethod method : values()) {
        if (method.value.equalsIgnoreCase(value.trim())) {
          return method;
        }
      }
    }
    throw new IllegalArgumentException("unsupported delivery method: " + value);
  }
}
