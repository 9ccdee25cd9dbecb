/*
 * Where: Notification domain model
 * What: Attribute bag for notification types without a dedicated shape
 */
package com.hirewise.notification.model.payload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record GenericPayload(@JsonValue Map<String, Object> attributes)
    implements NotificationPayload {

  private static final GenericPayload EMPTY = new GenericPayload(Map.of());

  public GenericPayload {
    // LinkedHashMap keeps insertion order and tolerates null values from JSON
    attributes =
        attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static GenericPayload of(Map<String, Object> attributes) {
    return new GenericPayload(attributes);
  }

  public static GenericPayload empty() {
    return EMPTY;
  }
}
