package com.hirewise.notification.model.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ApplicationReceivedPayload(
    String applicationId,
    String jobId,
    String applicantId,
    String applicantName,
    String jobTitle,
    Double matchScore,
    Instant appliedAt)
    implements NotificationPayload {}
