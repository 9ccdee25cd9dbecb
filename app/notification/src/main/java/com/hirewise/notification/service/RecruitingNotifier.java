/*
 * Where: Notification service layer
 * What: Recruiting events turned into notifications with their template context and priority
 * Why: Callers in the jobs and applications services describe what happened, not how to notify
 */
package com.hirewise.notification.service;

import com.google.common.annotations.VisibleForTesting;
import com.hirewise.notification.model.KnownNotificationType;
import com.hirewise.notification.model.NotificationPriority;
import com.hirewise.notification.model.payload.ApplicationReceivedPayload;
import com.hirewise.notification.model.payload.ApplicationStatusChangedPayload;
import com.hirewise.notification.model.payload.InterviewScheduledPayload;
import com.hirewise.notification.model.payload.JobPostedPayload;
import com.hirewise.notification.model.payload.MatchScoreCalculatedPayload;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RecruitingNotifier {

  private static final Logger logger = LoggerFactory.getLogger(RecruitingNotifier.class);

  static final String JOB_SEEKER_ROLE = "job_seeker";
  private static final String DEFAULT_COMPANY = "Company";
  private static final DateTimeFormatter DATE =
      DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH).withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter DATE_TIME =
      DateTimeFormatter.ofPattern("MMMM dd, yyyy 'at' HH:mm 'UTC'", Locale.ENGLISH)
          .withZone(ZoneOffset.UTC);
  private static final Map<String, NotificationPriority> STATUS_PRIORITY =
      Map.of(
          "shortlisted", NotificationPriority.HIGH,
          "interview_scheduled", NotificationPriority.HIGH,
          "hired", NotificationPriority.URGENT,
          "rejected", NotificationPriority.NORMAL);
  private static final Map<String, String> STATUS_MESSAGES =
      Map.of(
          "pending", "is under review",
          "reviewed", "has been reviewed",
          "shortlisted", "has been shortlisted",
          "interview_scheduled", "has an interview scheduled",
          "interviewed", "interview has been completed",
          "hired", "has been accepted! Congratulations!",
          "rejected", "was not selected this time");

  private final NotificationService notificationService;
  private final RecipientDirectory recipientDirectory;
  private final Clock clock;

  /** An empty target list announces the job to every active job seeker. */
  public BulkCreateResult notifyJobPosted(JobPosting job, List<String> targetUserIds) {
    try {
      final String company = companyOrDefault(job.companyName());
      final Map<String, Object> context = new LinkedHashMap<>();
      context.put("job_title", job.title());
      context.put("company_name", company);
      putIfPresent(context, "location", job.location());
      putIfPresent(context, "job_type", job.jobType());
      context.put("skills_required", job.skillsRequired());
      context.put("salary_range", formatSalaryRange(job.salaryMin(), job.salaryMax()));
      final JobPostedPayload payload =
          new JobPostedPayload(
              job.jobId(),
              job.title(),
              company,
              job.location(),
              job.jobType(),
              job.salaryMin(),
              job.salaryMax(),
              job.skillsRequired());
      final List<String> recipients =
          targetUserIds == null || targetUserIds.isEmpty()
              ? recipientDirectory.listActiveUserIds(JOB_SEEKER_ROLE)
              : targetUserIds;
      final BulkCreateResult result =
          notificationService.createBulk(
              recipients,
              new NotificationDraft(
                  KnownNotificationType.JOB_POSTED.value(),
                  "New Job: " + job.title(),
                  "New job posted: " + job.title() + " at " + company,
                  payload,
                  NotificationPriority.NORMAL,
                  null,
                  true,
                  context));
      logger.info(
          "job posted notifications sent jobId={} created={}",
          job.jobId(),
          result.created().size());
      return result;
    } catch (RuntimeException ex) {
      logger.error("job posted notification failed jobId={}", job.jobId(), ex);
      return BulkCreateResult.empty();
    }
  }

  /** Tells the recruiter about a new application. */
  public CreateOutcome notifyApplicationReceived(ApplicationSnapshot application) {
    final Map<String, Object> context = new LinkedHashMap<>();
    context.put("applicant_name", application.applicantName());
    context.put("job_title", application.jobTitle());
    context.put("company_name", companyOrDefault(application.companyName()));
    putIfPresent(context, "match_score", application.matchScore());
    if (application.appliedAt() != null) {
      context.put("application_date", DATE.format(application.appliedAt()));
    }
    return create(
        application.recruiterId(),
        new NotificationDraft(
            KnownNotificationType.APPLICATION_RECEIVED.value(),
            "New Application: " + application.jobTitle(),
            "New application from "
                + application.applicantName()
                + " for "
                + application.jobTitle(),
            new ApplicationReceivedPayload(
                application.applicationId(),
                application.jobId(),
                application.applicantId(),
                application.applicantName(),
                application.jobTitle(),
                application.matchScore(),
                application.appliedAt()),
            NotificationPriority.HIGH,
            null,
            true,
            context));
  }

  /** Tells the applicant their application moved from oldStatus to newStatus. */
  public CreateOutcome notifyApplicationStatusChanged(
      ApplicationSnapshot application, String oldStatus, String newStatus) {
    final String company = companyOrDefault(application.companyName());
    final Map<String, Object> context = new LinkedHashMap<>();
    context.put("job_title", application.jobTitle());
    context.put("company_name", company);
    context.put("old_status", titleCase(oldStatus));
    context.put("new_status", titleCase(newStatus));
    context.put(
        "status_message",
        STATUS_MESSAGES.getOrDefault(newStatus, "status changed to " + newStatus));
    context.put("status_date", DATE.format(Instant.now(clock)));
    return create(
        application.applicantId(),
        new NotificationDraft(
            KnownNotificationType.APPLICATION_STATUS_CHANGED.value(),
            "Application Update: " + application.jobTitle(),
            "Your application status for "
                + application.jobTitle()
                + " has been updated to "
                + titleCase(newStatus),
            new ApplicationStatusChangedPayload(
                application.applicationId(),
                application.jobId(),
                application.jobTitle(),
                company,
                oldStatus,
                newStatus,
                application.matchScore()),
            statusPriority(newStatus),
            null,
            true,
            context));
  }

  public CreateOutcome notifyMatchScore(String jobSeekerId, JobPosting job, double matchScore) {
    final String company = companyOrDefault(job.companyName());
    final String score = String.format(Locale.ROOT, "%.1f", matchScore);
    final Map<String, Object> context = new LinkedHashMap<>();
    context.put("job_title", job.title());
    context.put("company_name", company);
    context.put("match_score", score);
    putIfPresent(context, "location", job.location());
    context.put("salary_range", formatSalaryRange(job.salaryMin(), job.salaryMax()));
    return create(
        jobSeekerId,
        new NotificationDraft(
            KnownNotificationType.MATCH_SCORE_CALCULATED.value(),
            "Job Match: " + job.title(),
            "New job match found: " + job.title() + " (" + score + "% match)",
            new MatchScoreCalculatedPayload(
                job.jobId(),
                job.title(),
                company,
                job.location(),
                job.jobType(),
                matchScore,
                job.salaryMin(),
                job.salaryMax()),
            matchScorePriority(matchScore),
            null,
            true,
            context));
  }

  /** Both the applicant and the recruiter are told; returns their outcomes in that order. */
  public List<CreateOutcome> notifyInterviewScheduled(InterviewSchedule interview) {
    final ApplicationSnapshot application = interview.application();
    final String when =
        interview.scheduledAt() == null
            ? "a time to be confirmed"
            : DATE_TIME.format(interview.scheduledAt());
    final Map<String, Object> context = new LinkedHashMap<>();
    context.put("job_title", application.jobTitle());
    context.put("company_name", companyOrDefault(application.companyName()));
    context.put("interview_datetime", when);
    putIfPresent(context, "interview_type", interview.interviewType());
    final InterviewScheduledPayload payload =
        new InterviewScheduledPayload(
            application.applicationId(),
            application.jobId(),
            application.jobTitle(),
            interview.scheduledAt(),
            interview.location(),
            interview.meetingUrl());
    final NotificationDraft draft =
        new NotificationDraft(
            KnownNotificationType.INTERVIEW_SCHEDULED.value(),
            "Interview Scheduled: " + application.jobTitle(),
            "Interview scheduled for " + application.jobTitle() + " on " + when,
            payload,
            NotificationPriority.HIGH,
            null,
            true,
            context);
    return List.of(
        create(application.applicantId(), draft), create(application.recruiterId(), draft));
  }

  @VisibleForTesting
  static String formatSalaryRange(Integer salaryMin, Integer salaryMax) {
    final boolean hasMin = salaryMin != null && salaryMin != 0;
    final boolean hasMax = salaryMax != null && salaryMax != 0;
    if (hasMin && hasMax) {
      return String.format(Locale.US, "$%,d - $%,d", salaryMin, salaryMax);
    }
    if (hasMin) {
      return String.format(Locale.US, "$%,d+", salaryMin);
    }
    if (hasMax) {
      return String.format(Locale.US, "Up to $%,d", salaryMax);
    }
    return "Salary not specified";
  }

  @VisibleForTesting
  static NotificationPriority statusPriority(String newStatus) {
    return STATUS_PRIORITY.getOrDefault(newStatus, NotificationPriority.NORMAL);
  }

  @VisibleForTesting
  static NotificationPriority matchScorePriority(double matchScore) {
    if (matchScore >= 90) {
      return NotificationPriority.URGENT;
    }
    if (matchScore >= 75) {
      return NotificationPriority.HIGH;
    }
    return NotificationPriority.NORMAL;
  }

  /** interview_scheduled becomes "Interview Scheduled". */
  @VisibleForTesting
  static String titleCase(String status) {
    if (status == null || status.isBlank()) {
      return "";
    }
    final StringBuilder out = new StringBuilder();
    for (String word : status.replace('_', ' ').split(" ")) {
      if (word.isEmpty()) {
        continue;
      }
      if (out.length() > 0) {
        out.append(' ');
      }
      out.append(Character.toUpperCase(word.charAt(0)))
          .append(word.substring(1).toLowerCase(Locale.ROOT));
    }
    return out.toString();
  }

  private CreateOutcome create(String recipientId, NotificationDraft draft) {
    try {
      final CreateOutcome outcome = notificationService.create(recipientId, draft);
      logger.info(
          "recruiting notification handled type={} recipientId={} outcome={}",
          draft.notificationType(),
          recipientId,
          outcome.getClass().getSimpleName());
      return outcome;
    } catch (IllegalArgumentException ex) {
      logger.error(
          "recruiting notification rejected type={} recipientId={}",
          draft.notificationType(),
          recipientId,
          ex);
      return new CreateOutcome.Failed(
          recipientId, CreateOutcome.FailureReason.INVALID_REQUEST, ex.getMessage());
    }
  }

  private static String companyOrDefault(String company) {
    return company == null || company.isBlank() ? DEFAULT_COMPANY : company;
  }

  private static void putIfPresent(Map<String, Object> context, String key, Object value) {
    if (value != null) {
      context.put(key, value);
    }
  }
}
