package com.hirewise.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

/** status is marked or already_read. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MarkReadResponse(UUID notificationId, String status) {}
