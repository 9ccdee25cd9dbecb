package com.hirewise.notification.repository;

import static com.hirewise.common.JdbcTimestampUtils.toInstant;

import com.hirewise.notification.model.DeliveryMethod;
import com.hirewise.notification.model.NotificationTemplateRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationTemplateRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** At most one row matches; the partial unique index on active templates guarantees it. */
  public Optional<NotificationTemplateRecord> findActive(
      String notificationType, DeliveryMethod deliveryMethod) {
    final String sql =
        """
        SELECT template_id,
               notification_type,
               delivery_method,
               title_template,
               message_template,
               is_active,
               created_at
        FROM notification_templates
        WHERE notification_type = :notificationType
          AND delivery_method = :deliveryMethod
          AND is_active = TRUE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationType", notificationType)
            .addValue("deliveryMethod", deliveryMethod.value());
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private NotificationTemplateRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationTemplateRecord(
        UUID.fromString(rs.getString("template_id")),
        rs.getString("notification_type"),
        DeliveryMethod.fromValue(rs.getString("delivery_method")),
        rs.getString("title_template"),
        rs.getString("message_template"),
        rs.getBoolean("is_active"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
