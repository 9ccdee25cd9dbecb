package com.hirewise.notification.service;

import java.time.Instant;

public record InterviewSchedule(
    ApplicationSnapshot application,
    Instant scheduledAt,
    String interviewType,
    String location,
    String meetingUrl) {}
