package com.hirewise.notification.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** notification_type absent marks every type read. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MarkAllReadRequest(String notificationType) {}
