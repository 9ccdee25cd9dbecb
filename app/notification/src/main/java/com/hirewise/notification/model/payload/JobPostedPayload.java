package com.hirewise.notification.model.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobPostedPayload(
    String jobId,
    String jobTitle,
    String company,
    String location,
    String jobType,
    Integer salaryMin,
    Integer salaryMax,
    List<String> skillsRequired)
    implements NotificationPayload {

  public JobPostedPayload {
    skillsRequired = skillsRequired == null ? List.of() : List.copyOf(skillsRequired);
  }
}
