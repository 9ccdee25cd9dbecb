/*
 * Where: Notification service layer
 * What: Chooses live push, offline backlog and external transports for a stored notification
 * Why: Runs after commit; every failure is contained so delivery never undoes creation
 */
package com.hirewise.notification.service;

import com.hirewise.notification.config.NotificationDeliveryProperties;
import com.hirewise.notification.model.DeliveryMethod;
import com.hirewise.notification.model.NotificationRecord;
import com.hirewise.notification.model.event.NotificationPushEvent;
import com.hirewise.notification.repository.NotificationPayloadCodec;
import com.hirewise.notification.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeliveryRouter {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryRouter.class);

  private final PresenceOracle presenceOracle;
  private final PushChannel pushChannel;
  private final OfflineQueueService offlineQueueService;
  private final ExternalDeliveryTransport externalTransport;
  private final NotificationRepository notificationRepository;
  private final NotificationPayloadCodec payloadCodec;
  private final NotificationDeliveryProperties properties;
  private final NotificationMetrics metrics;
  private final Clock clock;

  public DeliveryOutcome route(
      NotificationRecord notification, DeliveryMethod deliveryMethod, boolean sendRealTime) {
    boolean pushed = false;
    boolean queued = false;
    if (deliveryMethod.includesLiveChannel()) {
      final boolean reachable = isReachable(notification.recipientId());
      if (reachable && sendRealTime) {
        pushed = push(notification);
        if (!pushed && properties.enqueueOnPushFailure()) {
          queued = enqueue(notification);
        }
      } else if (!reachable) {
        queued = enqueue(notification);
      }
    }
    final Set<DeliveryMethod> signalled = signalExternal(notification, deliveryMethod);
    return new DeliveryOutcome(pushed, queued, signalled);
  }

  /** A presence store outage counts as unreachable so the notification lands in the backlog. */
  boolean isReachable(String recipientId) {
    try {
      return presenceOracle.isReachable(recipientId);
    } catch (RuntimeException ex) {
      logger.warn("presence lookup failed, treating as offline recipientId={}", recipientId, ex);
      return false;
    }
  }

  private boolean push(NotificationRecord notification) {
    final Instant now = Instant.now(clock);
    try {
      pushChannel.publish(
          notification.recipientId(),
          NotificationPushEvent.live(
              notification.notificationId(),
              notification.notificationType(),
              notification.title(),
              notification.message(),
              payloadCodec.toTree(notification.payload()),
              notification.priority(),
              now));
    } catch (PushDeliveryException ex) {
      logger.warn(
          "live push failed id={} recipientId={}",
          notification.notificationId(),
          notification.recipientId(),
          ex);
      metrics.recordDeliveryResult("push_failed");
      return false;
    }
    metrics.recordDeliveryResult("pushed");
    metrics.recordDeliveryLatency(notification.createdAt(), now);
    try {
      notificationRepository.markSent(notification.notificationId(), now);
    } catch (DataAccessException ex) {
      logger.warn("pushed notification could not be marked sent id={}", notification.notificationId(), ex);
    }
    return true;
  }

  private boolean enqueue(NotificationRecord notification) {
    final boolean queued = offlineQueueService.enqueue(notification);
    metrics.recordDeliveryResult(queued ? "queued" : "enqueue_failed");
    return queued;
  }

  private Set<DeliveryMethod> signalExternal(
      NotificationRecord notification, DeliveryMethod deliveryMethod) {
    final Set<DeliveryMethod> signalled = EnumSet.noneOf(DeliveryMethod.class);
    for (DeliveryMethod channel : deliveryMethod.externalChannels()) {
      try {
        externalTransport.signal(channel, notification);
        signalled.add(channel);
        metrics.recordDeliveryResult("external");
      } catch (RuntimeException ex) {
        logger.warn(
            "external transport signal failed channel={} id={}",
            channel.value(),
            notification.notificationId(),
            ex);
      }
    }
    return signalled;
  }
}
