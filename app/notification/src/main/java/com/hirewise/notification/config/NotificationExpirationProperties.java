/*
 * Where: Notification application configuration binding
 * What: Schedule and batch bounds of the expired-notification sweep
 * Why: Batch size bounds how many rows one DELETE locks
 */
package com.hirewise.notification.config;

import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.expiration")
@Validated
public record NotificationExpirationProperties(
    boolean enabled,
    Duration cleanupInterval,
    @Positive int batchSize,
    @Positive int maxBatchesPerRun) {}
