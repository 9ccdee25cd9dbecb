package com.hirewise.notification.service;

import java.time.Instant;

public record ApplicationSnapshot(
    String applicationId,
    String jobId,
    String jobTitle,
    String companyName,
    String recruiterId,
    String applicantId,
    String applicantName,
    Double matchScore,
    Instant appliedAt) {}
