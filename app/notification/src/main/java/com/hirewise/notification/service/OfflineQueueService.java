/*
 * Where: Notification service layer
 * What: Parks notifications for unreachable recipients and replays them on reconnect
 * Why: Replay is triggered by presence events; the backlog is never polled
 */
package com.hirewise.notification.service;

import com.google.common.collect.Lists;
import com.hirewise.notification.config.NotificationBulkProperties;
import com.hirewise.notification.model.NotificationRecord;
import com.hirewise.notification.model.OfflineQueueEntry;
import com.hirewise.notification.model.event.NotificationPushEvent;
import com.hirewise.notification.repository.NotificationPayloadCodec;
import com.hirewise.notification.repository.NotificationRepository;
import com.hirewise.notification.repository.OfflineNotificationQueue;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class OfflineQueueService {

  private static final Logger logger = LoggerFactory.getLogger(OfflineQueueService.class);

  private final OfflineNotificationQueue offlineQueue;
  private final PushChannel pushChannel;
  private final NotificationRepository notificationRepository;
  private final NotificationPayloadCodec payloadCodec;
  private final NotificationMetrics metrics;
  private final NotificationBulkProperties bulkProperties;
  private final Clock clock;

  /** Returns false when the backlog store rejected the entry; the row stays listable. */
  public boolean enqueue(NotificationRecord notification) {
    final OfflineQueueEntry entry =
        new OfflineQueueEntry(
            notification.notificationId(),
            notification.notificationType(),
            notification.title(),
            notification.message(),
            payloadCodec.toTree(notification.payload()),
            notification.priority(),
            notification.createdAt(),
            Instant.now(clock));
    try {
      final long size = offlineQueue.enqueue(notification.recipientId(), entry);
      logger.debug(
          "notification queued offline id={} recipientId={} backlog={}",
          notification.notificationId(),
          notification.recipientId(),
          size);
      return true;
    } catch (RuntimeException ex) {
      logger.warn(
          "offline enqueue failed id={} recipientId={}",
          notification.notificationId(),
          notification.recipientId(),
          ex);
      return false;
    }
  }

  /**
   * Takes the whole backlog and replays it in arrival order. The backlog is cleared even when
   * some replays fail; failures are counted and logged.
   */
  public DrainResult drain(String recipientId) {
    final List<OfflineQueueEntry> entries = offlineQueue.drain(recipientId);
    if (entries.isEmpty()) {
      return DrainResult.empty();
    }
    final Instant deliveredAt = Instant.now(clock);
    final List<UUID> delivered = new ArrayList<>(entries.size());
    for (OfflineQueueEntry entry : entries) {
      try {
        pushChannel.publish(
            recipientId,
            NotificationPushEvent.replayed(
                entry.notificationId(),
                entry.notificationType(),
                entry.title(),
                entry.message(),
                entry.data(),
                entry.priority(),
                entry.queuedAt(),
                deliveredAt));
        delivered.add(entry.notificationId());
      } catch (PushDeliveryException ex) {
        logger.warn(
            "offline replay failed id={} recipientId={}", entry.notificationId(), recipientId, ex);
      }
    }
    markSent(recipientId, delivered, deliveredAt);
    final DrainResult result =
        new DrainResult(entries.size(), delivered.size(), entries.size() - delivered.size());
    metrics.recordReplay(result.delivered(), result.failed());
    logger.info(
        "offline backlog drained recipientId={} total={} delivered={} failed={}",
        recipientId,
        result.total(),
        result.delivered(),
        result.failed());
    return result;
  }

  public long backlogSize(String recipientId) {
    return offlineQueue.size(recipientId);
  }

  private void markSent(String recipientId, List<UUID> delivered, Instant sentAt) {
    if (delivered.isEmpty()) {
      return;
    }
    try {
      for (List<UUID> batch : Lists.partition(delivered, bulkProperties.batchSize())) {
        notificationRepository.markSent(batch, sentAt);
      }
    } catch (DataAccessException ex) {
      logger.warn(
          "replayed notifications could not be marked sent recipientId={} count={}",
          recipientId,
          delivered.size(),
          ex);
    }
  }
}
