/*
 * Where: Notification data access (Redis)
 * What: Offline backlog stored as a Redis list per recipient
 * Why: Lua scripts make append+trim+expire and read+delete atomic per key
 */
package com.hirewise.notification.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hirewise.notification.config.OfflineQueueProperties;
import com.hirewise.notification.model.OfflineQueueEntry;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(
    name = "notification.offline-queue.store",
    havingValue = "redis",
    matchIfMissing = true)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "StringRedisTemplate and ObjectMapper are shared Spring-managed components")
public class RedisOfflineNotificationQueue implements OfflineNotificationQueue {

  private static final Logger logger = LoggerFactory.getLogger(RedisOfflineNotificationQueue.class);

  private static final RedisScript<Long> ENQUEUE_SCRIPT =
      new DefaultRedisScript<>(
          """
          redis.call('RPUSH', KEYS[1], ARGV[1])
          redis.call('LTRIM', KEYS[1], -tonumber(ARGV[2]), -1)
          redis.call('PEXPIRE', KEYS[1], ARGV[3])
          return redis.call('LLEN', KEYS[1])
          """,
          Long.class);

  @SuppressWarnings("rawtypes")
  private static final RedisScript<List> DRAIN_SCRIPT =
      new DefaultRedisScript<>(
          """
          local items = redis.call('LRANGE', KEYS[1], 0, -1)
          redis.call('DEL', KEYS[1])
          return items
          """,
          List.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final OfflineQueueProperties properties;

  public RedisOfflineNotificationQueue(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      OfflineQueueProperties properties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public long enqueue(String recipientId, OfflineQueueEntry entry) {
    final Long size =
        redisTemplate.execute(
            ENQUEUE_SCRIPT,
            List.of(properties.keyFor(recipientId)),
            serialize(entry),
            String.valueOf(properties.capacity()),
            String.valueOf(properties.ttl().toMillis()));
    return size == null ? 0L : size;
  }

  @Override
  public List<OfflineQueueEntry> drain(String recipientId) {
    final List<?> raw = redisTemplate.execute(DRAIN_SCRIPT, List.of(properties.keyFor(recipientId)));
    final List<OfflineQueueEntry> entries = new ArrayList<>();
    if (raw == null) {
      return entries;
    }
    for (Object item : raw) {
      if (item == null) {
        continue;
      }
      try {
        entries.add(objectMapper.readValue(String.valueOf(item), OfflineQueueEntry.class));
      } catch (JsonProcessingException ex) {
        logger.warn("dropping unreadable offline entry; recipientId={}", recipientId, ex);
      }
    }
    return entries;
  }

  @Override
  public long size(String recipientId) {
    final Long size = redisTemplate.opsForList().size(properties.keyFor(recipientId));
    return size == null ? 0L : size;
  }

  private String serialize(OfflineQueueEntry entry) {
    try {
      return objectMapper.writeValueAsString(entry);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize offline entry", ex);
    }
  }
}
