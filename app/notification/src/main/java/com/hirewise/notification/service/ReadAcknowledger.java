/*
 * Where: Notification service layer
 * What: Marks notifications read and tells the recipient's other sessions about it
 * Why: Read state is monotonic; repeating a mark-read is harmless
 */
package com.hirewise.notification.service;

import com.hirewise.notification.model.event.BulkReadAcknowledgmentEvent;
import com.hirewise.notification.model.event.PushEvent;
import com.hirewise.notification.model.event.ReadAcknowledgmentEvent;
import com.hirewise.notification.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ReadAcknowledger {

  private static final Logger logger = LoggerFactory.getLogger(ReadAcknowledger.class);

  private final NotificationRepository notificationRepository;
  private final PresenceOracle presenceOracle;
  private final PushChannel pushChannel;
  private final Clock clock;

  /** Another recipient's notification is reported as NOT_FOUND. */
  public MarkReadResult markRead(UUID notificationId, String userId) {
    final Instant readAt = Instant.now(clock);
    if (notificationRepository.markRead(notificationId, userId, readAt) == 1) {
      acknowledge(userId, new ReadAcknowledgmentEvent(notificationId, readAt, readAt));
      return MarkReadResult.MARKED;
    }
    return notificationRepository
        .findByIdAndRecipient(notificationId, userId)
        .map(ignored -> MarkReadResult.ALREADY_READ)
        .orElse(MarkReadResult.NOT_FOUND);
  }

  /** notificationType null marks every type. Returns the number of rows that became read. */
  public int markAllRead(String userId, String notificationType) {
    final Instant readAt = Instant.now(clock);
    final int count = notificationRepository.markAllRead(userId, notificationType, readAt);
    if (count > 0) {
      acknowledge(userId, new BulkReadAcknowledgmentEvent(notificationType, count, readAt));
    }
    return count;
  }

  private void acknowledge(String userId, PushEvent event) {
    try {
      if (!presenceOracle.isReachable(userId)) {
        return;
      }
      pushChannel.publish(userId, event);
    } catch (RuntimeException ex) {
      logger.warn("read acknowledgment not delivered userId={} type={}", userId, event.type(), ex);
    }
  }
}
