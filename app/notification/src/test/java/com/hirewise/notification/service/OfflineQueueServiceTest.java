/*
 * Where: Offline backlog service unit test
 * What: Enqueue snapshots and replay on reconnect against the in-memory backlog
 * Why: A user who was offline must receive everything queued, in order, exactly once
 */
package com.hirewise.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.hirewise.notification.config.NotificationBulkProperties;
import com.hirewise.notification.config.OfflineQueueProperties;
import com.hirewise.notification.model.NotificationPriority;
import com.hirewise.notification.model.NotificationRecord;
import com.hirewise.notification.model.event.NotificationPushEvent;
import com.hirewise.notification.model.event.PushEvent;
import com.hirewise.notification.model.payload.GenericPayload;
import com.hirewise.notification.repository.InMemoryOfflineNotificationQueue;
import com.hirewise.notification.repository.NotificationPayloadCodec;
import com.hirewise.notification.repository.NotificationRepository;
import com.hirewise.notification.repository.OfflineNotificationQueue;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OfflineQueueServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T09:00:00Z");

  @Mock private PushChannel pushChannel;
  @Mock private NotificationRepository notificationRepository;
  @Mock private NotificationMetrics metrics;

  private OfflineQueueService service;

  @BeforeEach
  void setUp() {
    service = offlineQueueService(500);
  }

  @Test
  @SuppressWarnings("unchecked")
  void queuedNotificationsAreReplayedInOrderOnDrain() {
    final NotificationRecord first = record("first");
    final NotificationRecord second = record("second");
    assertThat(service.enqueue(first)).isTrue();
    assertThat(service.enqueue(second)).isTrue();
    assertThat(service.backlogSize("user-1")).isEqualTo(2);

    final DrainResult result = service.drain("user-1");

    assertThat(result).isEqualTo(new DrainResult(2, 2, 0));
    final ArgumentCaptor<PushEvent> events = ArgumentCaptor.forClass(PushEvent.class);
    verify(pushChannel, times(2)).publish(eq("user-1"), events.capture());
    assertThat(events.getAllValues())
        .extracting(event -> ((NotificationPushEvent) event).title())
        .containsExactly("first", "second");
    final NotificationPushEvent replayed = (NotificationPushEvent) events.getAllValues().get(0);
    assertThat(replayed.queued()).isTrue();
    assertThat(replayed.queuedAt()).isEqualTo(FIXED_NOW);
    assertThat(replayed.deliveredAt()).isEqualTo(FIXED_NOW);
    assertThat(replayed.data().get("source").asText()).isEqualTo("test");

    final ArgumentCaptor<Collection<UUID>> sent = ArgumentCaptor.forClass(Collection.class);
    verify(notificationRepository).markSent(sent.capture(), eq(FIXED_NOW));
    assertThat(sent.getValue()).containsExactly(first.notificationId(), second.notificationId());
    verify(metrics).recordReplay(2, 0);
    assertThat(service.backlogSize("user-1")).isZero();
  }

  @Test
  @SuppressWarnings("unchecked")
  void failedReplaysAreCountedAndBacklogIsStillCleared() {
    final NotificationRecord ok = record("ok");
    final NotificationRecord broken = record("broken");
    service.enqueue(ok);
    service.enqueue(broken);
    doNothing().doThrow(new PushDeliveryException("closed", new IllegalStateException()))
        .when(pushChannel)
        .publish(eq("user-1"), any());

    final DrainResult result = service.drain("user-1");

    assertThat(result).isEqualTo(new DrainResult(2, 1, 1));
    final ArgumentCaptor<Collection<UUID>> sent = ArgumentCaptor.forClass(Collection.class);
    verify(notificationRepository).markSent(sent.capture(), eq(FIXED_NOW));
    assertThat(sent.getValue()).containsExactly(ok.notificationId());
    assertThat(service.drain("user-1")).isEqualTo(DrainResult.empty());
  }

  @Test
  void drainOfEmptyBacklogTouchesNothing() {
    assertThat(service.drain("user-1")).isEqualTo(DrainResult.empty());
    verifyNoInteractions(pushChannel, notificationRepository, metrics);
  }

  @Test
  void enqueueFailureIsReportedNotThrown() {
    final OfflineNotificationQueue failing = Mockito.mock(OfflineNotificationQueue.class);
    Mockito.when(failing.enqueue(any(), any())).thenThrow(new IllegalStateException("redis down"));
    final OfflineQueueService failingService =
        new OfflineQueueService(
            failing,
            pushChannel,
            notificationRepository,
            new NotificationPayloadCodec(JsonMapper.builder().findAndAddModules().build()),
            metrics,
            new NotificationBulkProperties(500),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));

    assertThat(failingService.enqueue(record("x"))).isFalse();
  }

  @Test
  @SuppressWarnings("unchecked")
  void replayedNotificationsAreMarkedSentInBatches() {
    final OfflineQueueService batched = offlineQueueService(2);
    final NotificationRecord first = record("first");
    final NotificationRecord second = record("second");
    final NotificationRecord third = record("third");
    batched.enqueue(first);
    batched.enqueue(second);
    batched.enqueue(third);

    assertThat(batched.drain("user-1")).isEqualTo(new DrainResult(3, 3, 0));

    final ArgumentCaptor<Collection<UUID>> sent = ArgumentCaptor.forClass(Collection.class);
    verify(notificationRepository, times(2)).markSent(sent.capture(), eq(FIXED_NOW));
    assertThat(sent.getAllValues().get(0))
        .containsExactly(first.notificationId(), second.notificationId());
    assertThat(sent.getAllValues().get(1)).containsExactly(third.notificationId());
  }

  private OfflineQueueService offlineQueueService(int markSentBatchSize) {
    final Clock clock = Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
    final OfflineNotificationQueue queue =
        new InMemoryOfflineNotificationQueue(
            new OfflineQueueProperties("memory", "offline_notifications:", 100, Duration.ofDays(7)),
            clock);
    return new OfflineQueueService(
        queue,
        pushChannel,
        notificationRepository,
        new NotificationPayloadCodec(JsonMapper.builder().findAndAddModules().build()),
        metrics,
        new NotificationBulkProperties(markSentBatchSize),
        clock);
  }

  private static NotificationRecord record(String title) {
    return NotificationRecord.unread(
        UUID.randomUUID(),
        "user-1",
        "system_update",
        title,
        "message",
        GenericPayload.of(Map.of("source", "test")),
        NotificationPriority.NORMAL,
        FIXED_NOW.minusSeconds(30),
        null);
  }
}
