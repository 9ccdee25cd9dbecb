/*
 * Where: Notification service layer
 * What: Records create outcomes, delivery results, push latency and backlog activity
 * Why: Delivery health is observable from Prometheus without reading logs
 */
package com.hirewise.notification.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component")
public class NotificationMetrics {

  private static final String METRIC_CREATE_TOTAL = "notification.create.total";
  private static final String METRIC_DELIVERY_TOTAL = "notification.delivery.total";
  private static final String METRIC_DELIVERY_LATENCY = "notification.delivery.latency";
  private static final String METRIC_OFFLINE_REPLAYED = "notification.offline.replayed.total";
  private static final String METRIC_EXPIRED_DELETED = "notification.expired.deleted.total";
  private static final String METRIC_EXPIRED_LAST_RUN = "notification.expired.last_run.deleted";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> createCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> replayCounters = new ConcurrentHashMap<>();
  private final AtomicInteger expiredLastRun = new AtomicInteger(0);
  private final Counter expiredDeleted;
  private final Timer deliveryLatency;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_EXPIRED_LAST_RUN, expiredLastRun, AtomicInteger::get)
        .description("Notifications deleted by the most recent expiration sweep")
        .register(meterRegistry);
    this.expiredDeleted =
        Counter.builder(METRIC_EXPIRED_DELETED)
            .description("Total number of expired notifications deleted")
            .register(meterRegistry);
    this.deliveryLatency =
        Timer.builder(METRIC_DELIVERY_LATENCY)
            .description("Delay from notification creation to live push")
            .register(meterRegistry);
  }

  /** outcome is created, suppressed or a failure reason in lower case. */
  public void recordCreateOutcome(String outcome, int count) {
    if (count <= 0) {
      return;
    }
    counter(createCounters, METRIC_CREATE_TOTAL, "Notification create outcomes", "outcome", outcome)
        .increment(count);
  }

  /** result is pushed, queued, push_failed, enqueue_failed or external. */
  public void recordDeliveryResult(String result) {
    counter(deliveryCounters, METRIC_DELIVERY_TOTAL, "Notification delivery results", "result", result)
        .increment();
  }

  public void recordDeliveryLatency(Instant createdAt, Instant pushedAt) {
    if (createdAt == null || pushedAt == null || pushedAt.isBefore(createdAt)) {
      return;
    }
    deliveryLatency.record(Duration.between(createdAt, pushedAt));
  }

  public void recordReplay(int delivered, int failed) {
    counter(replayCounters, METRIC_OFFLINE_REPLAYED, "Offline backlog replays", "result", "delivered")
        .increment(Math.max(delivered, 0));
    counter(replayCounters, METRIC_OFFLINE_REPLAYED, "Offline backlog replays", "result", "failed")
        .increment(Math.max(failed, 0));
  }

  public void recordExpiredDeleted(int deleted) {
    final int value = Math.max(deleted, 0);
    expiredLastRun.set(value);
    expiredDeleted.increment(value);
  }

  private Counter counter(
      ConcurrentMap<String, Counter> cache,
      String name,
      String description,
      String tagKey,
      String tagValue) {
    return cache.computeIfAbsent(
        tagValue,
        ignored ->
            Counter.builder(name)
                .description(description)
                .tags(Tags.of(tagKey, tagValue))
                .register(meterRegistry));
  }
}
