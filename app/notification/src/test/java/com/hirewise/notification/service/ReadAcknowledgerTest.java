package com.hirewise.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.hirewise.notification.model.NotificationPriority;
import com.hirewise.notification.model.NotificationRecord;
import com.hirewise.notification.model.event.BulkReadAcknowledgmentEvent;
import com.hirewise.notification.model.event.PushEvent;
import com.hirewise.notification.model.event.ReadAcknowledgmentEvent;
import com.hirewise.notification.model.payload.GenericPayload;
import com.hirewise.notification.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReadAcknowledgerTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T09:00:00Z");
  private static final UUID NOTIFICATION_ID = UUID.randomUUID();

  @Mock private NotificationRepository notificationRepository;
  @Mock private PresenceOracle presenceOracle;
  @Mock private PushChannel pushChannel;

  private ReadAcknowledger acknowledger;

  @BeforeEach
  void setUp() {
    acknowledger =
        new ReadAcknowledger(
            notificationRepository,
            presenceOracle,
            pushChannel,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void firstMarkReadPublishesAcknowledgmentToOnlineUser() {
    when(notificationRepository.markRead(NOTIFICATION_ID, "user-1", FIXED_NOW)).thenReturn(1);
    when(presenceOracle.isReachable("user-1")).thenReturn(true);

    assertThat(acknowledger.markRead(NOTIFICATION_ID, "user-1")).isEqualTo(MarkReadResult.MARKED);

    final ArgumentCaptor<PushEvent> event = ArgumentCaptor.forClass(PushEvent.class);
    verify(pushChannel).publish(eq("user-1"), event.capture());
    assertThat(event.getValue())
        .isEqualTo(new ReadAcknowledgmentEvent(NOTIFICATION_ID, FIXED_NOW, FIXED_NOW));
  }

  @Test
  void repeatedMarkReadIsAlreadyReadWithoutAcknowledgment() {
    when(notificationRepository.markRead(NOTIFICATION_ID, "user-1", FIXED_NOW)).thenReturn(0);
    when(notificationRepository.findByIdAndRecipient(NOTIFICATION_ID, "user-1"))
        .thenReturn(Optional.of(readRecord()));

    assertThat(acknowledger.markRead(NOTIFICATION_ID, "user-1"))
        .isEqualTo(MarkReadResult.ALREADY_READ);
    verifyNoInteractions(pushChannel, presenceOracle);
  }

  @Test
  void someoneElsesNotificationIsNotFound() {
    when(notificationRepository.markRead(NOTIFICATION_ID, "intruder", FIXED_NOW)).thenReturn(0);
    when(notificationRepository.findByIdAndRecipient(NOTIFICATION_ID, "intruder"))
        .thenReturn(Optional.empty());

    assertThat(acknowledger.markRead(NOTIFICATION_ID, "intruder"))
        .isEqualTo(MarkReadResult.NOT_FOUND);
  }

  @Test
  void offlineUserGetsNoAcknowledgment() {
    when(notificationRepository.markRead(NOTIFICATION_ID, "user-1", FIXED_NOW)).thenReturn(1);
    when(presenceOracle.isReachable("user-1")).thenReturn(false);

    assertThat(acknowledger.markRead(NOTIFICATION_ID, "user-1")).isEqualTo(MarkReadResult.MARKED);
    verifyNoInteractions(pushChannel);
  }

  @Test
  void markAllReadAcknowledgesCountAndSurvivesPushFailure() {
    when(notificationRepository.markAllRead("user-1", "job_posted", FIXED_NOW)).thenReturn(3);
    when(presenceOracle.isReachable("user-1")).thenReturn(true);
    doThrow(new PushDeliveryException("closed", new IllegalStateException()))
        .when(pushChannel)
        .publish(eq("user-1"), any());

    assertThat(acknowledger.markAllRead("user-1", "job_posted")).isEqualTo(3);
    verify(pushChannel)
        .publish("user-1", new BulkReadAcknowledgmentEvent("job_posted", 3, FIXED_NOW));
  }

  @Test
  void markAllReadWithNothingUnreadIsSilent() {
    when(notificationRepository.markAllRead("user-1", null, FIXED_NOW)).thenReturn(0);

    assertThat(acknowledger.markAllRead("user-1", null)).isZero();
    verifyNoInteractions(presenceOracle, pushChannel);
  }

  private static NotificationRecord readRecord() {
    return new NotificationRecord(
        NOTIFICATION_ID,
        "user-1",
        "system_update",
        "title",
        "message",
        GenericPayload.empty(),
        NotificationPriority.NORMAL,
        true,
        true,
        FIXED_NOW.minusSeconds(60),
        FIXED_NOW.minusSeconds(30),
        FIXED_NOW.minusSeconds(59),
        null);
  }
}
