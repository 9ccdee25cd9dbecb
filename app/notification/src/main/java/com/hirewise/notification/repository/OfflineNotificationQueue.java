/*
 * Where: Notification data access
 * What: Per-recipient backlog of notifications that could not be delivered live
 * Why: Lets the backing store be swapped between Redis and the in-process ring buffer
 */
package com.hirewise.notification.repository;

import com.hirewise.notification.model.OfflineQueueEntry;
import java.util.List;

public interface OfflineNotificationQueue {

  /**
   * Appends the entry, keeps only the most recent entries up to capacity and restarts the
   * backlog's time-to-live.
   *
   * @return backlog size after the append
   */
  long enqueue(String recipientId, OfflineQueueEntry entry);

  /** Returns the backlog oldest first and removes it in the same step. */
  List<OfflineQueueEntry> drain(String recipientId);

  long size(String recipientId);
}
