/*
 * Where: Notification repository integration test
 * What: Listing order, read transitions, sent marking and the expiry sweep on Postgres
 * Why: Ordering and the read_at constraint live in SQL and must hold on the real dialect
 */
package com.hirewise.notification.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.google.common.base.Strings;
import com.hirewise.notification.AbstractPostgresContainerTest;
import com.hirewise.notification.model.NotificationPriority;
import com.hirewise.notification.model.NotificationRecord;
import com.hirewise.notification.model.payload.GenericPayload;
import com.hirewise.notification.model.payload.JobPostedPayload;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T09:00:00Z");
  private static final String ALICE = "user-alice";
  private static final String BOB = "user-bob";

  @Autowired private NotificationRepository notificationRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM notifications", new MapSqlParameterSource());
  }

  @Test
  void findPageOrdersByPriorityThenNewestFirst() {
    final NotificationRecord oldUrgent =
        record(ALICE, "system_update", NotificationPriority.URGENT, BASE_TIME);
    final NotificationRecord newNormal =
        record(ALICE, "system_update", NotificationPriority.NORMAL, BASE_TIME.plusSeconds(60));
    final NotificationRecord newerNormal =
        record(ALICE, "system_update", NotificationPriority.NORMAL, BASE_TIME.plusSeconds(120));
    final NotificationRecord low =
        record(ALICE, "system_update", NotificationPriority.LOW, BASE_TIME.plusSeconds(300));
    notificationRepository.insertBatch(List.of(low, newNormal, oldUrgent, newerNormal));

    final List<NotificationRecord> page = notificationRepository.findPage(ALICE, null, null, 10, 0);

    assertThat(page)
        .extracting(NotificationRecord::notificationId)
        .containsExactly(
            oldUrgent.notificationId(),
            newerNormal.notificationId(),
            newNormal.notificationId(),
            low.notificationId());
  }

  @Test
  void findPageAppliesFiltersLimitAndOffset() {
    for (int i = 0; i < 5; i++) {
      notificationRepository.insert(
          record(ALICE, "job_posted", NotificationPriority.NORMAL, BASE_TIME.plusSeconds(i)));
    }
    notificationRepository.insert(
        record(ALICE, "message_received", NotificationPriority.NORMAL, BASE_TIME));
    notificationRepository.insert(record(BOB, "job_posted", NotificationPriority.NORMAL, BASE_TIME));

    final List<NotificationRecord> page =
        notificationRepository.findPage(ALICE, "job_posted", false, 2, 2);

    assertThat(page).hasSize(2);
    assertThat(page).allMatch(item -> item.recipientId().equals(ALICE));
    assertThat(page).allMatch(item -> item.notificationType().equals("job_posted"));
    assertThat(notificationRepository.count(ALICE, "job_posted", false)).isEqualTo(5);
    assertThat(notificationRepository.count(ALICE, null, null)).isEqualTo(6);
    assertThat(notificationRepository.countUnread(BOB)).isEqualTo(1);
  }

  @Test
  void typedPayloadSurvivesTheJsonbColumn() {
    final NotificationRecord posted =
        NotificationRecord.unread(
            UUID.randomUUID(),
            ALICE,
            "job_posted",
            "New Job: Backend Engineer",
            "New job posted",
            new JobPostedPayload(
                "job-1", "Backend Engineer", "Acme", "Remote", "full_time", 100000, 150000,
                List.of("java", "sql")),
            NotificationPriority.NORMAL,
            BASE_TIME,
            null);
    notificationRepository.insert(posted);

    final NotificationRecord loaded =
        notificationRepository.findByIdAndRecipient(posted.notificationId(), ALICE).orElseThrow();

    assertThat(loaded.payload()).isEqualTo(posted.payload());
    assertThat(loaded.createdAt()).isEqualTo(BASE_TIME);
  }

  @Test
  void titleAtTheColumnWidthIsStored() {
    final String title = Strings.repeat("t", NotificationRecord.TITLE_MAX_LENGTH);
    final NotificationRecord record =
        NotificationRecord.unread(
            UUID.randomUUID(),
            ALICE,
            "job_posted",
            title,
            "message",
            GenericPayload.empty(),
            NotificationPriority.NORMAL,
            BASE_TIME,
            null);
    notificationRepository.insert(record);

    assertThat(
            notificationRepository
                .findByIdAndRecipient(record.notificationId(), ALICE)
                .orElseThrow()
                .title())
        .isEqualTo(title);
  }

  @Test
  void markReadIsScopedToRecipientAndOnlyTransitionsOnce() {
    final NotificationRecord record =
        record(ALICE, "system_update", NotificationPriority.NORMAL, BASE_TIME);
    notificationRepository.insert(record);
    final Instant readAt = BASE_TIME.plus(Duration.ofMinutes(5));

    assertThat(notificationRepository.markRead(record.notificationId(), BOB, readAt)).isZero();
    assertThat(notificationRepository.markRead(record.notificationId(), ALICE, readAt)).isEqualTo(1);
    assertThat(
            notificationRepository.markRead(
                record.notificationId(), ALICE, readAt.plus(Duration.ofMinutes(1))))
        .isZero();

    final NotificationRecord loaded =
        notificationRepository.findByIdAndRecipient(record.notificationId(), ALICE).orElseThrow();
    assertThat(loaded.read()).isTrue();
    assertThat(loaded.readAt()).isEqualTo(readAt);
  }

  @Test
  void markAllReadHonoursTypeFilterAndRecipient() {
    notificationRepository.insert(record(ALICE, "job_posted", NotificationPriority.NORMAL, BASE_TIME));
    notificationRepository.insert(record(ALICE, "job_posted", NotificationPriority.HIGH, BASE_TIME));
    notificationRepository.insert(
        record(ALICE, "message_received", NotificationPriority.NORMAL, BASE_TIME));
    notificationRepository.insert(record(BOB, "job_posted", NotificationPriority.NORMAL, BASE_TIME));

    assertThat(notificationRepository.markAllRead(ALICE, "job_posted", BASE_TIME)).isEqualTo(2);
    assertThat(notificationRepository.countUnread(ALICE)).isEqualTo(1);
    assertThat(notificationRepository.countUnread(BOB)).isEqualTo(1);

    assertThat(notificationRepository.markAllRead(ALICE, null, BASE_TIME)).isEqualTo(1);
    assertThat(notificationRepository.countUnread(ALICE)).isZero();
  }

  @Test
  void markSentSetsTimestampOnlyOnce() {
    final NotificationRecord first =
        record(ALICE, "system_update", NotificationPriority.NORMAL, BASE_TIME);
    final NotificationRecord second =
        record(ALICE, "system_update", NotificationPriority.NORMAL, BASE_TIME);
    notificationRepository.insertBatch(List.of(first, second));

    assertThat(notificationRepository.markSent(first.notificationId(), BASE_TIME)).isEqualTo(1);
    assertThat(
            notificationRepository.markSent(
                List.of(first.notificationId(), second.notificationId()),
                BASE_TIME.plusSeconds(10)))
        .isEqualTo(1);

    final NotificationRecord loaded =
        notificationRepository.findByIdAndRecipient(first.notificationId(), ALICE).orElseThrow();
    assertThat(loaded.sent()).isTrue();
    assertThat(loaded.sentAt()).isEqualTo(BASE_TIME);
  }

  @Test
  void deleteIsScopedToRecipient() {
    final NotificationRecord record =
        record(ALICE, "system_update", NotificationPriority.NORMAL, BASE_TIME);
    notificationRepository.insert(record);

    assertThat(notificationRepository.deleteByIdAndRecipient(record.notificationId(), BOB)).isZero();
    assertThat(notificationRepository.deleteByIdAndRecipient(record.notificationId(), ALICE))
        .isEqualTo(1);
    assertThat(notificationRepository.findByIdAndRecipient(record.notificationId(), ALICE))
        .isEmpty();
  }

  @Test
  void deleteExpiredBatchRemovesOnlyPastExpiries() {
    final Instant now = BASE_TIME.plus(Duration.ofDays(1));
    for (int i = 0; i < 3; i++) {
      notificationRepository.insert(expiring(now.minusSeconds(60 + i)));
    }
    notificationRepository.insert(expiring(now.plusSeconds(60)));
    notificationRepository.insert(record(ALICE, "system_update", NotificationPriority.LOW, BASE_TIME));

    assertThat(notificationRepository.countExpired(now)).isEqualTo(3);
    assertThat(notificationRepository.deleteExpiredBatch(now, 2)).isEqualTo(2);
    assertThat(notificationRepository.deleteExpiredBatch(now, 2)).isEqualTo(1);
    assertThat(notificationRepository.deleteExpiredBatch(now, 2)).isZero();
    assertThat(notificationRepository.count(ALICE, null, null)).isEqualTo(2);
  }

  private static NotificationRecord record(
      String recipientId, String type, NotificationPriority priority, Instant createdAt) {
    return NotificationRecord.unread(
        UUID.randomUUID(),
        recipientId,
        type,
        "title",
        "message",
        GenericPayload.of(Map.of("source", "test")),
        priority,
        createdAt,
        null);
  }

  private static NotificationRecord expiring(Instant expiresAt) {
    return NotificationRecord.unread(
        UUID.randomUUID(),
        ALICE,
        "system_update",
        "maintenance",
        "window",
        GenericPayload.empty(),
        NotificationPriority.NORMAL,
        BASE_TIME,
        expiresAt);
  }
}
