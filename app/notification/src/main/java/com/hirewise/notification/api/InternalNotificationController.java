/*
 * Where: Notification internal API
 * What: Service-to-service endpoints that create notifications
 * Why: Other platform services trigger notifications without linking the engine in-process
 */
package com.hirewise.notification.api;

import com.hirewise.notification.api.request.BulkCreateNotificationRequest;
import com.hirewise.notification.api.request.CreateNotificationRequest;
import com.hirewise.notification.api.response.BulkCreateNotificationResponse;
import com.hirewise.notification.api.response.CreateNotificationResponse;
import com.hirewise.notification.api.response.NotificationItemResponse;
import com.hirewise.notification.model.NotificationRecord;
import com.hirewise.notification.service.BulkCreateResult;
import com.hirewise.notification.service.CreateOutcome;
import com.hirewise.notification.service.NotificationService;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/notifications")
@RequiredArgsConstructor
public class InternalNotificationController {

  private final NotificationService notificationService;
  private final Clock clock;

  /** 201 when stored, 200 when suppressed by preference; failures map to error statuses. */
  @PostMapping
  public ResponseEntity<CreateNotificationResponse> create(
      @Valid @RequestBody CreateNotificationRequest request) {
    final CreateOutcome outcome =
        notificationService.create(request.recipientId(), request.toDraft());
    if (outcome instanceof CreateOutcome.Created created) {
      return ResponseEntity.status(HttpStatus.CREATED)
          .body(
              CreateNotificationResponse.created(
                  created.deliveryMethod().value(),
                  NotificationItemResponse.from(created.notification(), Instant.now(clock))));
    }
    if (outcome instanceof CreateOutcome.Suppressed suppressed) {
      return ResponseEntity.ok(
          CreateNotificationResponse.suppressed(suppressed.reason().name().toLowerCase(Locale.ROOT)));
    }
    throw new NotificationCreateFailedException((CreateOutcome.Failed) outcome);
  }

  @PostMapping("/bulk")
  public ResponseEntity<BulkCreateNotificationResponse> createBulk(
      @Valid @RequestBody BulkCreateNotificationRequest request) {
    final BulkCreateResult result =
        notificationService.createBulk(request.recipientIds(), request.toDraft());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            new BulkCreateNotificationResponse(
                result.created().size(),
                result.created().stream().map(NotificationRecord::notificationId).toList(),
                result.suppressedRecipientIds(),
                result.unknownRecipientIds()));
  }
}
