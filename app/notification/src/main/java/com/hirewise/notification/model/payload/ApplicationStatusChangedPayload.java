package com.hirewise.notification.model.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ApplicationStatusChangedPayload(
    String applicationId,
    String jobId,
    String jobTitle,
    String company,
    String oldStatus,
    String newStatus,
    Double matchScore)
    implements NotificationPayload {}
