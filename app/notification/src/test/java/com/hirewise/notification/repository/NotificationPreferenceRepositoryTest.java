package com.hirewise.notification.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.hirewise.notification.AbstractPostgresContainerTest;
import com.hirewise.notification.model.DeliveryMethod;
import com.hirewise.notification.model.KnownNotificationType;
import com.hirewise.notification.model.NotificationPreferenceRecord;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationPreferenceRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

  @Autowired private NotificationPreferenceRepository preferenceRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM notification_preferences", new MapSqlParameterSource());
  }

  @Test
  void insertIfAbsentKeepsExistingRows() {
    final NotificationPreferenceRecord customized = withJobPostedDisabled("user-a");
    preferenceRepository.upsert(customized);

    final int inserted =
        preferenceRepository.insertIfAbsent(
            List.of(
                NotificationPreferenceRecord.defaults("user-a", NOW),
                NotificationPreferenceRecord.defaults("user-b", NOW)));

    assertThat(inserted).isEqualTo(1);
    final Map<String, NotificationPreferenceRecord> loaded =
        preferenceRepository.findByRecipientIds(List.of("user-a", "user-b", "user-c"));
    assertThat(loaded).containsOnlyKeys("user-a", "user-b");
    assertThat(loaded.get("user-a").isEnabled("job_posted")).isFalse();
    assertThat(loaded.get("user-b").isEnabled("job_posted")).isTrue();
  }

  @Test
  void upsertRoundTripsOverridesAndDefaultMethod() {
    preferenceRepository.upsert(NotificationPreferenceRecord.defaults("user-a", NOW));
    final NotificationPreferenceRecord updated =
        new NotificationPreferenceRecord(
            "user-a",
            Map.of(KnownNotificationType.SYSTEM_UPDATE, false),
            DeliveryMethod.EMAIL,
            Map.of("job_posted", DeliveryMethod.PUSH),
            NOW,
            NOW.plusSeconds(30));
    preferenceRepository.upsert(updated);

    final NotificationPreferenceRecord loaded =
        preferenceRepository.findByRecipientId("user-a").orElseThrow();
    assertThat(loaded.defaultDeliveryMethod()).isEqualTo(DeliveryMethod.EMAIL);
    assertThat(loaded.deliveryMethodFor("job_posted")).isEqualTo(DeliveryMethod.PUSH);
    assertThat(loaded.deliveryMethodFor("message_received")).isEqualTo(DeliveryMethod.EMAIL);
    assertThat(loaded.isEnabled("system_update")).isFalse();
    assertThat(loaded.isEnabled("interview_scheduled")).isTrue();
    assertThat(loaded.createdAt()).isEqualTo(NOW);
    assertThat(loaded.updatedAt()).isEqualTo(NOW.plusSeconds(30));
  }

  private static NotificationPreferenceRecord withJobPostedDisabled(String recipientId) {
    final Map<KnownNotificationType, Boolean> gates = new EnumMap<>(KnownNotificationType.class);
    gates.put(KnownNotificationType.JOB_POSTED, false);
    return new NotificationPreferenceRecord(
        recipientId, gates, DeliveryMethod.WEBSOCKET, Map.of(), NOW, NOW);
  }
}
