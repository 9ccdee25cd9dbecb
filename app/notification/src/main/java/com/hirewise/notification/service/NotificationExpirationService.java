/*
 * Where: Notification service layer
 * What: Deletes notifications whose expires_at has passed, batch by batch
 * Why: Bounded batches keep lock time short; SKIP LOCKED lets overlapping sweeps coexist
 */
package com.hirewise.notification.service;

import com.hirewise.notification.config.NotificationExpirationProperties;
import com.hirewise.notification.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class NotificationExpirationService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationExpirationService.class);

  private final NotificationRepository notificationRepository;
  private final NotificationExpirationProperties properties;
  private final NotificationMetrics metrics;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public NotificationExpirationService(
      NotificationRepository notificationRepository,
      NotificationExpirationProperties properties,
      NotificationMetrics metrics,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    this.notificationRepository = notificationRepository;
    this.properties = properties;
    this.metrics = metrics;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.clock = clock;
  }

  /** Returns the number of rows deleted in this run. */
  public int deleteExpired() {
    final Instant now = Instant.now(clock);
    int total = 0;
    for (int batch = 0; batch < properties.maxBatchesPerRun(); batch++) {
      final Integer deleted =
          transactionTemplate.execute(
              status -> notificationRepository.deleteExpiredBatch(now, properties.batchSize()));
      final int count = deleted == null ? 0 : deleted;
      total += count;
      if (count < properties.batchSize()) {
        break;
      }
    }
    metrics.recordExpiredDeleted(total);
    logger.info("expired notifications deleted count={} now={}", total, now);
    return total;
  }

  public int countExpired() {
    return notificationRepository.countExpired(Instant.now(clock));
  }
}
