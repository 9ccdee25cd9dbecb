/*
 * Where: Notification application configuration binding
 * What: NATS connection settings
 * Why: Switch the push channel endpoint per environment
 */
package com.hirewise.notification.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(boolean enabled, String url, Integer connectionTimeout) {

  public NatsProperties {
    url = url == null || url.isBlank() ? "nats://localhost:4222" : url;
    connectionTimeout = connectionTimeout == null ? 2 : connectionTimeout;
  }
}
