/*
 * Where: Notification API
 * What: Recipient-facing inbox endpoints: listing, read state, deletion, queued delivery
 * Why: The caller is identified by X-User-Id and only ever sees their own notifications
 */
package com.hirewise.notification.api;

import com.hirewise.notification.api.request.MarkAllReadRequest;
import com.hirewise.notification.api.response.MarkAllReadResponse;
import com.hirewise.notification.api.response.MarkReadResponse;
import com.hirewise.notification.api.response.NotificationItemResponse;
import com.hirewise.notification.api.response.NotificationListResponse;
import com.hirewise.notification.api.response.QueuedDeliveryResponse;
import com.hirewise.notification.api.response.UnreadCountResponse;
import com.hirewise.notification.config.RequestMdcInterceptor;
import com.hirewise.notification.service.DrainResult;
import com.hirewise.notification.service.MarkReadResult;
import com.hirewise.notification.service.NotificationPage;
import com.hirewise.notification.service.NotificationService;
import com.hirewise.notification.service.OfflineQueueService;
import com.hirewise.notification.service.ReadAcknowledger;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

  private static final String HEADER_USER_ID = RequestMdcInterceptor.USER_ID_HEADER;

  private final NotificationService notificationService;
  private final ReadAcknowledger readAcknowledger;
  private final OfflineQueueService offlineQueueService;
  private final Clock clock;

  @GetMapping
  public ResponseEntity<NotificationListResponse> list(
      @RequestHeader(HEADER_USER_ID) String userId,
      @RequestParam(name = "type", required = false) String type,
      @RequestParam(name = "is_read", required = false) Boolean isRead,
      @RequestParam(name = "limit", required = false) Integer limit,
      @RequestParam(name = "offset", required = false) Integer offset) {
    final NotificationPage page = notificationService.list(userId, type, isRead, limit, offset);
    final Instant now = Instant.now(clock);
    return ResponseEntity.ok(
        new NotificationListResponse(
            page.notifications().stream()
                .map(record -> NotificationItemResponse.from(record, now))
                .toList(),
            page.totalCount(),
            page.unreadCount(),
            page.hasMore(),
            page.limit(),
            page.offset()));
  }

  @GetMapping("/unread-count")
  public ResponseEntity<UnreadCountResponse> unreadCount(
      @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(new UnreadCountResponse(notificationService.unreadCount(userId)));
  }

  @PostMapping("/{notificationId}/read")
  public ResponseEntity<MarkReadResponse> markRead(
      @PathVariable("notificationId") UUID notificationId,
      @RequestHeader(HEADER_USER_ID) String userId) {
    final MarkReadResult result = readAcknowledger.markRead(notificationId, userId);
    if (result == MarkReadResult.NOT_FOUND) {
      throw new NotificationNotFoundException(notificationId);
    }
    final String status = result == MarkReadResult.MARKED ? "marked" : "already_read";
    return ResponseEntity.ok(new MarkReadResponse(notificationId, status));
  }

  @PostMapping("/read-all")
  public ResponseEntity<MarkAllReadResponse> markAllRead(
      @RequestHeader(HEADER_USER_ID) String userId,
      @RequestBody(required = false) MarkAllReadRequest request) {
    final String type = request == null ? null : request.notificationType();
    final String effectiveType = type == null || type.isBlank() ? null : type;
    return ResponseEntity.ok(
        new MarkAllReadResponse(
            effectiveType, readAcknowledger.markAllRead(userId, effectiveType)));
  }

  @DeleteMapping("/{notificationId}")
  public ResponseEntity<Void> delete(
      @PathVariable("notificationId") UUID notificationId,
      @RequestHeader(HEADER_USER_ID) String userId) {
    if (!notificationService.delete(notificationId, userId)) {
      throw new NotificationNotFoundException(notificationId);
    }
    return ResponseEntity.noContent().build();
  }

  /** Replays the caller's offline backlog on demand, e.g. after a client-side reconnect. */
  @PostMapping("/queued/deliver")
  public ResponseEntity<QueuedDeliveryResponse> deliverQueued(
      @RequestHeader(HEADER_USER_ID) String userId) {
    final DrainResult result = offlineQueueService.drain(userId);
    return ResponseEntity.ok(
        new QueuedDeliveryResponse(result.total(), result.delivered(), result.failed()));
  }
}
