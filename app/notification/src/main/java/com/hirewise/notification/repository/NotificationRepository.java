/*
 * Where: Notification data access
 * What: Insert, listing, read/sent transitions and expiry sweeps on the notifications table
 * Why: Every mutation is a single statement scoped to the recipient so callers need no locking
 */
package com.hirewise.notification.repository;

import static com.hirewise.common.JdbcTimestampUtils.toInstant;
import static com.hirewise.common.JdbcTimestampUtils.toTimestamp;

import com.hirewise.notification.model.NotificationPriority;
import com.hirewise.notification.model.NotificationRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT notification_id,
             recipient_id,
             notification_type,
             title,
             message,
             data::text AS data_text,
             priority,
             is_read,
             is_sent,
             created_at,
             read_at,
             sent_at,
             expires_at
      FROM notifications
      """;

  private static final String PRIORITY_RANK =
      """
      CASE priority
        WHEN 'urgent' THEN 4
        WHEN 'high' THEN 3
        WHEN 'normal' THEN 2
        ELSE 1
      END
      """;

  private static final String INSERT_SQL =
      """
      INSERT INTO notifications (
        notification_id,
        recipient_id,
        notification_type,
        title,
        message,
        data,
        priority,
        is_read,
        is_sent,
        created_at,
        read_at,
        sent_at,
        expires_at
      ) VALUES (
        :notificationId,
        :recipientId,
        :notificationType,
        :title,
        :message,
        :data::jsonb,
        :priority,
        :read,
        :sent,
        :createdAt,
        :readAt,
        :sentAt,
        :expiresAt
      )
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final NotificationPayloadCodec payloadCodec;

  public void insert(NotificationRecord record) {
    jdbcTemplate.update(INSERT_SQL, insertParams(record));
  }

  /** Inserts all rows with one JDBC batch; the caller owns the transaction. */
  public int insertBatch(List<NotificationRecord> records) {
    if (records.isEmpty()) {
      return 0;
    }
    final SqlParameterSource[] batch =
        records.stream().map(this::insertParams).toArray(SqlParameterSource[]::new);
    final int[] counts = jdbcTemplate.batchUpdate(INSERT_SQL, batch);
    int inserted = 0;
    for (int count : counts) {
      // Drivers may report SUCCESS_NO_INFO (-2) for batched statements.
      inserted += count < 0 ? 1 : count;
    }
    return inserted;
  }

  public Optional<NotificationRecord> findByIdAndRecipient(
      UUID notificationId, String recipientId) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE notification_id = :notificationId
              AND recipient_id = :recipientId
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("recipientId", recipientId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Highest priority first, then newest; notification_id breaks ties so pages are stable. */
  public List<NotificationRecord> findPage(
      String recipientId, String notificationType, Boolean read, int limit, int offset) {
    final MapSqlParameterSource params = filterParams(recipientId, notificationType, read);
    params.addValue("limit", limit).addValue("offset", offset);
    final String sql =
        SELECT_COLUMNS
            + filterClause(notificationType, read)
            + " ORDER BY "
            + PRIORITY_RANK
            + " DESC, created_at DESC, notification_id\n"
            + "LIMIT :limit OFFSET :offset";
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int count(String recipientId, String notificationType, Boolean read) {
    final String sql = "SELECT COUNT(*) FROM notifications\n" + filterClause(notificationType, read);
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, filterParams(recipientId, notificationType, read), Integer.class);
    return count == null ? 0 : count;
  }

  public int countUnread(String recipientId) {
    return count(recipientId, null, Boolean.FALSE);
  }

  /** Sets is_read only on an unread row of this recipient; returns 1 on the transition. */
  public int markRead(UUID notificationId, String recipientId, Instant readAt) {
    final String sql =
        """
        UPDATE notifications
        SET is_read = TRUE,
            read_at = :readAt
        WHERE notification_id = :notificationId
          AND recipient_id = :recipientId
          AND is_read = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("recipientId", recipientId)
            .addValue("readAt", toTimestamp(readAt));
    return jdbcTemplate.update(sql, params);
  }

  public int markAllRead(String recipientId, String notificationType, Instant readAt) {
    final StringBuilder sql =
        new StringBuilder(
            """
            UPDATE notifications
            SET is_read = TRUE,
                read_at = :readAt
            WHERE recipient_id = :recipientId
              AND is_read = FALSE
            """);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", recipientId)
            .addValue("readAt", toTimestamp(readAt));
    if (notificationType != null) {
      sql.append("  AND notification_type = :notificationType\n");
      params.addValue("notificationType", notificationType);
    }
    return jdbcTemplate.update(sql.toString(), params);
  }

  public int markSent(UUID notificationId, Instant sentAt) {
    return markSent(List.of(notificationId), sentAt);
  }

  public int markSent(Collection<UUID> notificationIds, Instant sentAt) {
    if (notificationIds.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        UPDATE notifications
        SET is_sent = TRUE,
            sent_at = :sentAt
        WHERE notification_id IN (:notificationIds)
          AND is_sent = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationIds", notificationIds)
            .addValue("sentAt", toTimestamp(sentAt));
    return jdbcTemplate.update(sql, params);
  }

  public int deleteByIdAndRecipient(UUID notificationId, String recipientId) {
    final String sql =
        """
        DELETE FROM notifications
        WHERE notification_id = :notificationId
          AND recipient_id = :recipientId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("recipientId", recipientId);
    return jdbcTemplate.update(sql, params);
  }

  /** Rows locked by a concurrent sweep are skipped, not waited on. */
  public int deleteExpiredBatch(Instant now, int batchSize) {
    final String sql =
        """
        DELETE FROM notifications
        WHERE notification_id IN (
          SELECT notification_id
          FROM notifications
          WHERE expires_at IS NOT NULL
            AND expires_at < :now
          ORDER BY expires_at
          LIMIT :batchSize
          FOR UPDATE SKIP LOCKED
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("batchSize", batchSize);
    return jdbcTemplate.update(sql, params);
  }

  public int countExpired(Instant now) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notifications
        WHERE expires_at IS NOT NULL
          AND expires_at < :now
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource("now", toTimestamp(now)), Integer.class);
    return count == null ? 0 : count;
  }

  private String filterClause(String notificationType, Boolean read) {
    final StringBuilder clause = new StringBuilder("WHERE recipient_id = :recipientId\n");
    if (notificationType != null) {
      clause.append("  AND notification_type = :notificationType\n");
    }
    if (read != null) {
      clause.append("  AND is_read = :read\n");
    }
    return clause.toString();
  }

  private MapSqlParameterSource filterParams(
      String recipientId, String notificationType, Boolean read) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("recipientId", recipientId);
    if (notificationType != null) {
      params.addValue("notificationType", notificationType);
    }
    if (read != null) {
      params.addValue("read", read);
    }
    return params;
  }

  private MapSqlParameterSource insertParams(NotificationRecord record) {
    return new MapSqlParameterSource()
        .addValue("notificationId", record.notificationId())
        .addValue("recipientId", record.recipientId())
        .addValue("notificationType", record.notificationType())
        .addValue("title", record.title())
        .addValue("message", record.message())
        .addValue("data", payloadCodec.toJson(record.payload()))
        .addValue("priority", record.priority().value())
        .addValue("read", record.read())
        .addValue("sent", record.sent())
        .addValue("createdAt", toTimestamp(record.createdAt()))
        .addValue("readAt", toTimestamp(record.readAt()))
        .addValue("sentAt", toTimestamp(record.sentAt()))
        .addValue("expiresAt", toTimestamp(record.expiresAt()));
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String notificationType = rs.getString("notification_type");
    return new NotificationRecord(
        UUID.fromString(rs.getString("notification_id")),
        rs.getString("recipient_id"),
        notificationType,
        rs.getString("title"),
        rs.getString("message"),
        payloadCodec.fromJson(notificationType, rs.getString("data_text")),
        NotificationPriority.fromValue(rs.getString("priority")),
        rs.getBoolean("is_read"),
        rs.getBoolean("is_sent"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("read_at")),
        toInstant(rs.getTimestamp("sent_at")),
        toInstant(rs.getTimestamp("expires_at")));
  }
}
