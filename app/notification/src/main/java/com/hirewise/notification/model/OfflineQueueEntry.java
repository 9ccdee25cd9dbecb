/*
 * Where: Notification domain model
 * What: Snapshot of a notification parked for an unreachable recipient
 * Why: Replayed on reconnect without re-reading the notifications table
 */
package com.hirewise.notification.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
    justification = "data is a Jackson tree that is serialized immediately and never mutated")
public record OfflineQueueEntry(
    UUID notificationId,
    String notificationType,
    String title,
    String message,
    JsonNode data,
    NotificationPriority priority,
    Instant createdAt,
    Instant queuedAt) {}
