package com.hirewise.notification.model.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchScoreCalculatedPayload(
    String jobId,
    String jobTitle,
    String company,
    String location,
    String jobType,
    double matchScore,
    Integer salaryMin,
    Integer salaryMax)
    implements NotificationPayload {}
