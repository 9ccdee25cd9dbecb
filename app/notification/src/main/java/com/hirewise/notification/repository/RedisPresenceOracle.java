/*
 * Where: Notification data access (Redis)
 * What: Reads the presence keys the connection gateway maintains
 * Why: The gateway owns presence; the engine only checks key existence
 */
package com.hirewise.notification.repository;

import com.hirewise.notification.config.PresenceProperties;
import com.hirewise.notification.service.PresenceOracle;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RedisPresenceOracle implements PresenceOracle {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate is a shared Spring-managed component")
  private final StringRedisTemplate redisTemplate;

  private final PresenceProperties properties;

  public RedisPresenceOracle(StringRedisTemplate redisTemplate, PresenceProperties properties) {
    this.redisTemplate = redisTemplate;
    this.properties = properties;
  }

  @Override
  public boolean isReachable(String recipientId) {
    return Boolean.TRUE.equals(redisTemplate.hasKey(properties.keyPrefix() + recipientId));
  }
}
