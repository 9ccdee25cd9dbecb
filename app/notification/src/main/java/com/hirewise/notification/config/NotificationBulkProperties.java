package com.hirewise.notification.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Rows per JDBC batch when fanning out one notification to many recipients. */
@ConfigurationProperties(prefix = "notification.bulk")
@Validated
public record NotificationBulkProperties(@Positive int batchSize) {}
