/*
 * Where: Notification data access (in-process)
 * What: Offline backlog kept in memory with the same capacity and TTL policy as Redis
 * Why: Single-node deployments and tests run without a Redis server
 */
package com.hirewise.notification.repository;

import com.google.common.annotations.VisibleForTesting;
import com.hirewise.notification.config.OfflineQueueProperties;
import com.hirewise.notification.model.OfflineQueueEntry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "notification.offline-queue.store", havingValue = "memory")
public class InMemoryOfflineNotificationQueue implements OfflineNotificationQueue {

  private static final Duration SWEEP_INTERVAL = Duration.ofMinutes(1);

  private final ConcurrentMap<String, Slot> backlogs = new ConcurrentHashMap<>();
  private final AtomicReference<Instant> nextSweepAt = new AtomicReference<>(Instant.MIN);
  private final OfflineQueueProperties properties;
  private final Clock clock;

  public InMemoryOfflineNotificationQueue(OfflineQueueProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public long enqueue(String recipientId, OfflineQueueEntry entry) {
    final Instant now = Instant.now(clock);
    evictExpired(now);
    // compute() runs under the map's per-key lock, so appends for one recipient serialize.
    final Slot slot =
        backlogs.compute(
            recipientId,
            (key, current) -> {
              final Slot target =
                  current == null || current.isExpired(now)
                      ? new Slot(new BoundedBacklog<>(properties.capacity()))
                      : current;
              synchronized (target) {
                target.backlog.append(entry);
                target.expiresAt = now.plus(properties.ttl());
              }
              return target;
            });
    synchronized (slot) {
      return slot.backlog.size();
    }
  }

  @Override
  public List<OfflineQueueEntry> drain(String recipientId) {
    final Instant now = Instant.now(clock);
    evictExpired(now);
    final Slot slot = backlogs.remove(recipientId);
    if (slot == null) {
      return List.of();
    }
    synchronized (slot) {
      return slot.isExpired(now) ? List.of() : slot.backlog.drain();
    }
  }

  @Override
  public long size(String recipientId) {
    final Slot slot = backlogs.get(recipientId);
    if (slot == null) {
      return 0L;
    }
    synchronized (slot) {
      return slot.isExpired(Instant.now(clock)) ? 0L : slot.backlog.size();
    }
  }

  @VisibleForTesting
  int trackedRecipients() {
    return backlogs.size();
  }

  /**
   * Drops every slot whose TTL has passed, at most once per sweep interval. removeIf on the
   * values view only removes a slot that is still mapped, so a concurrent enqueue is never lost.
   */
  private void evictExpired(Instant now) {
    final Instant due = nextSweepAt.get();
    if (now.isBefore(due) || !nextSweepAt.compareAndSet(due, now.plus(SWEEP_INTERVAL))) {
      return;
    }
    backlogs.values().removeIf(slot -> slot.isExpired(now));
  }

  private static final class Slot {
    private final BoundedBacklog<OfflineQueueEntry> backlog;
    private volatile Instant expiresAt;

    private Slot(BoundedBacklog<OfflineQueueEntry> backlog) {
      this.backlog = backlog;
    }

    private boolean isExpired(Instant now) {
      return expiresAt != null && !now.isBefore(expiresAt);
    }
  }
}
