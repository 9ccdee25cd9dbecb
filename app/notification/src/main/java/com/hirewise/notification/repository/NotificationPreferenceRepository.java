/*
 * Where: Notification data access
 * What: Reads and writes notification_preferences rows
 * Why: Gates are columns so bulk fan-out can load thousands of recipients in one query
 */
package com.hirewise.notification.repository;

import static com.hirewise.common.JdbcTimestampUtils.toInstant;
import static com.hirewise.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hirewise.notification.model.DeliveryMethod;
import com.hirewise.notification.model.KnownNotificationType;
import com.hirewise.notification.model.NotificationPreferenceRecord;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "JDBC template and ObjectMapper are shared Spring-managed components")
public class NotificationPreferenceRepository {

  private static final Logger logger =
      LoggerFactory.getLogger(NotificationPreferenceRepository.class);
  private static final TypeReference<Map<String, String>> OVERRIDES = new TypeReference<>() {};

  private static final String SELECT_COLUMNS =
      """
      SELECT recipient_id,
             job_posted,
             application_received,
             application_status_changed,
             match_score_calculated,
             interview_scheduled,
             message_received,
             system_update,
             default_delivery_method,
             delivery_overrides::text AS delivery_overrides_text,
             created_at,
             updated_at
      FROM notification_preferences
      """;

  private static final String UPSERT_COLUMNS =
      """
      INSERT INTO notification_preferences (
        recipient_id,
        job_posted,
        application_received,
        application_status_changed,
        match_score_calculated,
        interview_scheduled,
        message_received,
        system_update,
        default_delivery_method,
        delivery_overrides,
        created_at,
        updated_at
      ) VALUES (
        :recipientId,
        :jobPosted,
        :applicationReceived,
        :applicationStatusChanged,
        :matchScoreCalculated,
        :interviewScheduled,
        :messageReceived,
        :systemUpdate,
        :defaultDeliveryMethod,
        :deliveryOverrides::jsonb,
        :createdAt,
        :updatedAt
      )
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public NotificationPreferenceRepository(
      NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
  }

  public Optional<NotificationPreferenceRecord> findByRecipientId(String recipientId) {
    final String sql = SELECT_COLUMNS + "WHERE recipient_id = :recipientId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("recipientId", recipientId), this::mapRow)
        .stream()
        .findFirst();
  }

  public Map<String, NotificationPreferenceRecord> findByRecipientIds(
      Collection<String> recipientIds) {
    final Map<String, NotificationPreferenceRecord> found = new LinkedHashMap<>();
    if (recipientIds.isEmpty()) {
      return found;
    }
    final String sql = SELECT_COLUMNS + "WHERE recipient_id IN (:recipientIds)";
    jdbcTemplate
        .query(sql, new MapSqlParameterSource("recipientIds", recipientIds), this::mapRow)
        .forEach(record -> found.put(record.recipientId(), record));
    return found;
  }

  /** Rows that already exist are left untouched; returns the number actually inserted. */
  public int insertIfAbsent(List<NotificationPreferenceRecord> records) {
    if (records.isEmpty()) {
      return 0;
    }
    final String sql = UPSERT_COLUMNS + "ON CONFLICT (recipient_id) DO NOTHING";
    final SqlParameterSource[] batch =
        records.stream().map(this::params).toArray(SqlParameterSource[]::new);
    int inserted = 0;
    for (int count : jdbcTemplate.batchUpdate(sql, batch)) {
      inserted += Math.max(count, 0);
    }
    return inserted;
  }

  public void upsert(NotificationPreferenceRecord record) {
    final String sql =
        UPSERT_COLUMNS
            + """
            ON CONFLICT (recipient_id) DO UPDATE SET
              job_posted = EXCLUDED.job_posted,
              application_received = EXCLUDED.application_received,
              application_status_changed = EXCLUDED.application_status_changed,
              match_score_calculated = EXCLUDED.match_score_calculated,
              interview_scheduled = EXCLUDED.interview_scheduled,
              message_received = EXCLUDED.message_received,
              system_update = EXCLUDED.system_update,
              default_delivery_method = EXCLUDED.default_delivery_method,
              delivery_overrides = EXCLUDED.delivery_overrides,
              updated_at = EXCLUDED.updated_at
            """;
    jdbcTemplate.update(sql, params(record));
  }

  private MapSqlParameterSource params(NotificationPreferenceRecord record) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("recipientId", record.recipientId());
    for (KnownNotificationType type : KnownNotificationType.values()) {
      params.addValue(paramName(type), record.gates().getOrDefault(type, Boolean.TRUE));
    }
    return params
        .addValue("defaultDeliveryMethod", record.defaultDeliveryMethod().value())
        .addValue("deliveryOverrides", writeOverrides(record.deliveryOverrides()))
        .addValue("createdAt", toTimestamp(record.createdAt()))
        .addValue("updatedAt", toTimestamp(record.updatedAt()));
  }

  private NotificationPreferenceRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final Map<KnownNotificationType, Boolean> gates = new EnumMap<>(KnownNotificationType.class);
    for (KnownNotificationType type : KnownNotificationType.values()) {
      gates.put(type, rs.getBoolean(type.value()));
    }
    return new NotificationPreferenceRecord(
        rs.getString("recipient_id"),
        gates,
        DeliveryMethod.fromValue(rs.getString("default_delivery_method")),
        readOverrides(rs.getString("recipient_id"), rs.getString("delivery_overrides_text")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }

  private String writeOverrides(Map<String, DeliveryMethod> overrides) {
    final Map<String, String> raw = new LinkedHashMap<>();
    overrides.forEach((type, method) -> raw.put(type, method.value()));
    try {
      return objectMapper.writeValueAsString(raw);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize delivery overrides", ex);
    }
  }

  private Map<String, DeliveryMethod> readOverrides(String recipientId, String json) {
    final Map<String, DeliveryMethod> overrides = new LinkedHashMap<>();
    if (json == null || json.isBlank()) {
      return overrides;
    }
    try {
      final Map<String, String> raw = objectMapper.readValue(json, OVERRIDES);
      raw.forEach((type, method) -> overrides.put(type, DeliveryMethod.fromValue(method)));
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      logger.warn("ignoring unreadable delivery overrides; recipientId={}", recipientId, ex);
    }
    return overrides;
  }

  private static String paramName(KnownNotificationType type) {
    return switch (type) {
      case JOB_POSTED -> "jobPosted";
      case APPLICATION_RECEIVED -> "applicationReceived";
      case APPLICATION_STATUS_CHANGED -> "applicationStatusChanged";
      case MATCH_SCORE_CALCULATED -> "matchScoreCalculated";
      case INTERVIEW_SCHEDULED -> "interviewScheduled";
      case MESSAGE_RECEIVED -> "messageReceived";
      case SYSTEM_UPDATE -> "systemUpdate";
    };
  }
}
