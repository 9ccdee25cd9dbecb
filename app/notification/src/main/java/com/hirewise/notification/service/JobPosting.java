package com.hirewise.notification.service;

import java.util.List;

/** Job details needed to announce a posting; owned by the jobs service. */
public record JobPosting(
    String jobId,
    String title,
    String companyName,
    String location,
    String jobType,
    Integer salaryMin,
    Integer salaryMax,
    List<String> skillsRequired) {

  public JobPosting {
    skillsRequired = skillsRequired == null ? List.of() : List.copyOf(skillsRequired);
  }
}
