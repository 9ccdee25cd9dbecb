/*
 * Where: Notification data access
 * What: Converts NotificationPayload to and from the notifications.data jsonb column
 * Why: The concrete payload record is chosen by the row's notification_type
 */
package com.hirewise.notification.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hirewise.notification.model.KnownNotificationType;
import com.hirewise.notification.model.payload.ApplicationReceivedPayload;
import com.hirewise.notification.model.payload.ApplicationStatusChangedPayload;
import com.hirewise.notification.model.payload.GenericPayload;
import com.hirewise.notification.model.payload.InterviewScheduledPayload;
import com.hirewise.notification.model.payload.JobPostedPayload;
import com.hirewise.notification.model.payload.MatchScoreCalculatedPayload;
import com.hirewise.notification.model.payload.MessageReceivedPayload;
import com.hirewise.notification.model.payload.NotificationPayload;
import com.hirewise.notification.model.payload.SystemUpdatePayload;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class NotificationPayloadCodec {

  private static final Logger logger = LoggerFactory.getLogger(NotificationPayloadCodec.class);
  private static final TypeReference<Map<String, Object>> ATTRIBUTES = new TypeReference<>() {};
  private static final Map<KnownNotificationType, Class<? extends NotificationPayload>> SHAPES =
      shapes();

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper is the shared Spring-managed instance")
  private final ObjectMapper objectMapper;

  public NotificationPayloadCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String toJson(NotificationPayload payload) {
    try {
      return objectMapper.writeValueAsString(payload == null ? GenericPayload.empty() : payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize notification payload", ex);
    }
  }

  public JsonNode toTree(NotificationPayload payload) {
    return objectMapper.valueToTree(payload == null ? GenericPayload.empty() : payload);
  }

  /** Rows whose data no longer fits the registered shape are read back as a generic bag. */
  public NotificationPayload fromJson(String notificationType, String json) {
    if (json == null || json.isBlank()) {
      return GenericPayload.empty();
    }
    try {
      final Optional<Class<? extends NotificationPayload>> shape = shapeOf(notificationType);
      if (shape.isPresent()) {
        return objectMapper.readValue(json, shape.get());
      }
      return GenericPayload.of(objectMapper.readValue(json, ATTRIBUTES));
    } catch (JsonProcessingException ex) {
      logger.warn(
          "notification payload does not match its type; notificationType={}",
          notificationType,
          ex);
      return readGeneric(json);
    }
  }

  /**
   * Converts caller-supplied attributes into the shape registered for the type.
   *
   * @throws IllegalArgumentException when the attributes do not fit that shape
   */
  public NotificationPayload normalize(String notificationType, NotificationPayload payload) {
    if (payload == null) {
      return GenericPayload.empty();
    }
    final Optional<Class<? extends NotificationPayload>> shape = shapeOf(notificationType);
    if (shape.isEmpty() || shape.get().isInstance(payload)) {
      return payload;
    }
    if (!(payload instanceof GenericPayload generic)) {
      throw new IllegalArgumentException(
          "payload " + payload.getClass().getSimpleName() + " does not match " + notificationType);
    }
    if (generic.attributes().isEmpty()) {
      return generic;
    }
    try {
      return objectMapper.convertValue(generic.attributes(), shape.get());
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("data does not match " + notificationType, ex);
    }
  }

  private NotificationPayload readGeneric(String json) {
    try {
      return GenericPayload.of(objectMapper.readValue(json, ATTRIBUTES));
    } catch (JsonProcessingException ex) {
      logger.warn("notification payload is not a JSON object", ex);
      return GenericPayload.empty();
    }
  }

  private static Optional<Class<? extends NotificationPayload>> shapeOf(String notificationType) {
    return KnownNotificationType.find(notificationType).map(SHAPES::get);
  }

  private static Map<KnownNotificationType, Class<? extends NotificationPayload>> shapes() {
    final Map<KnownNotificationType, Class<? extends NotificationPayload>> shapes =
        new EnumMap<>(KnownNotificationType.class);
    shapes.put(KnownNotificationType.JOB_POSTED, JobPostedPayload.class);
    shapes.put(KnownNotificationType.APPLICATION_RECEIVED, ApplicationReceivedPayload.class);
    shapes.put(
        KnownNotificationType.APPLICATION_STATUS_CHANGED, ApplicationStatusChangedPayload.class);
    shapes.put(KnownNotificationType.MATCH_SCORE_CALCULATED, MatchScoreCalculatedPayload.class);
    shapes.put(KnownNotificationType.INTERVIEW_SCHEDULED, InterviewScheduledPayload.class);
    shapes.put(KnownNotificationType.MESSAGE_RECEIVED, MessageReceivedPayload.class);
    shapes.put(KnownNotificationType.SYSTEM_UPDATE, SystemUpdatePayload.class);
    return shapes;
  }
}
