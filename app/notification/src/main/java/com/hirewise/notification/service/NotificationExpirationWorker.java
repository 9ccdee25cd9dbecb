/*
 * Where: Notification cleanup worker
 * What: Triggers the expired-notification sweep on a schedule
 * Why: A failed run is logged and the next run starts normally
 */
package com.hirewise.notification.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notification.expiration.enabled", havingValue = "true")
public class NotificationExpirationWorker {

  private static final Logger logger = LoggerFactory.getLogger(NotificationExpirationWorker.class);

  private final NotificationExpirationService expirationService;

  @Scheduled(fixedDelayString = "${notification.expiration.cleanup-interval}")
  public void run() {
    try {
      expirationService.deleteExpired();
    } catch (RuntimeException ex) {
      logger.error("expired notification sweep failed", ex);
    }
  }
}
