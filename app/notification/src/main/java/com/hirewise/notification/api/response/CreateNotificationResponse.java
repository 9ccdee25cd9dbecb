package com.hirewise.notification.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** outcome is created or suppressed; failures are returned as ApiErrorResponse. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateNotificationResponse(
    String outcome, String deliveryMethod, NotificationItemResponse notification, String reason) {

  public static CreateNotificationResponse created(
      String deliveryMethod, NotificationItemResponse notification) {
    return new CreateNotificationResponse("created", deliveryMethod, notification, null);
  }

  public static CreateNotificationResponse suppressed(String reason) {
    return new CreateNotificationResponse("suppressed", null, null, reason);
  }
}
