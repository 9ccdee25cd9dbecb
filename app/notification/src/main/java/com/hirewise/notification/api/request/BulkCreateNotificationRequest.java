package com.hirewise.notification.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.hirewise.notification.model.NotificationPriority;
import com.hirewise.notification.model.NotificationRecord;
import com.hirewise.notification.model.payload.GenericPayload;
import com.hirewise.notification.service.NotificationDraft;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "request DTO is read once and converted immediately")
public record BulkCreateNotificationRequest(
    @NotEmpty List<String> recipientIds,
    @NotBlank @Size(max = 50) String notificationType,
    @NotBlank @Size(max = NotificationRecord.TITLE_MAX_LENGTH) String title,
    String message,
    Map<String, Object> data,
    String priority,
    Instant expiresAt,
    Boolean sendRealTime,
    Map<String, Object> templateContext) {

  public NotificationDraft toDraft() {
    return new NotificationDraft(
        notificationType,
        title,
        message == null ? "" : message,
        data == null ? null : GenericPayload.of(data),
        NotificationPriority.fromValue(priority),
        expiresAt,
        sendRealTime == null || sendRealTime,
        templateContext);
  }
}
