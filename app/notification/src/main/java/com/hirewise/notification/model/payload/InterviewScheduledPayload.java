package com.hirewise.notification.model.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InterviewScheduledPayload(
    String applicationId,
    String jobId,
    String jobTitle,
    Instant scheduledAt,
    String location,
    String meetingUrl)
    implements NotificationPayload {}
