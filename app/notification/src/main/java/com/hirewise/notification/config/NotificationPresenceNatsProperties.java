/*
 * Where: Notification configuration
 * What: Subject and queue group for gateway presence events
 * Why: Only one engine instance in the group drains a reconnecting user's backlog
 */
package com.hirewise.notification.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.presence-nats")
@Validated
public record NotificationPresenceNatsProperties(@NotBlank String subject, @NotBlank String queueGroup) {}
