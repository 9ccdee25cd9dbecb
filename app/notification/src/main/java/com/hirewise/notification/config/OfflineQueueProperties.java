/*
 * Where: Notification application configuration binding
 * What: Backing store, key namespace, capacity and TTL of the offline backlog
 * Why: The backlog bound and retention are operational limits, not constants
 */
package com.hirewise.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.offline-queue")
@Validated
public record OfflineQueueProperties(
    @NotBlank String store,
    @NotBlank String keyPrefix,
    @Positive int capacity,
    @NotNull Duration ttl) {

  public String keyFor(String recipientId) {
    return keyPrefix + recipientId;
  }

  @AssertTrue(message = "notification.offline-queue.ttl must be positive")
  public boolean isTtlPositive() {
    return ttl != null && !ttl.isZero() && !ttl.isNegative();
  }
}
