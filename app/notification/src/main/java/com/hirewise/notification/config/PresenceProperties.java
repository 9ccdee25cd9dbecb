package com.hirewise.notification.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Key namespace of the presence entries the gateway writes to Redis. */
@ConfigurationProperties(prefix = "notification.presence")
@Validated
public record PresenceProperties(@NotBlank String keyPrefix) {}
