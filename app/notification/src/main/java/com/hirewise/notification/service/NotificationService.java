/*
 * Where: Notification service layer
 * What: Creates notifications (single and bulk), lists them and deletes them
 * Why: Gating, rendering and persistence happen in one place; delivery starts only after commit
 */
package com.hirewise.notification.service;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;
import com.hirewise.notification.config.NotificationBulkProperties;
import com.hirewise.notification.config.NotificationListingProperties;
import com.hirewise.notification.model.DeliveryMethod;
import com.hirewise.notification.model.NotificationPreferenceRecord;
import com.hirewise.notification.model.NotificationRecord;
import com.hirewise.notification.model.payload.NotificationPayload;
import com.hirewise.notification.repository.NotificationPayloadCodec;
import com.hirewise.notification.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class NotificationService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);

  private final NotificationRepository notificationRepository;
  private final PreferenceService preferenceService;
  private final TemplateRenderer templateRenderer;
  private final RecipientDirectory recipientDirectory;
  private final DeliveryRouter deliveryRouter;
  private final NotificationPayloadCodec payloadCodec;
  private final NotificationBulkProperties bulkProperties;
  private final NotificationListingProperties listingProperties;
  private final NotificationMetrics metrics;
  private final TaskExecutor deliveryExecutor;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public NotificationService(
      NotificationRepository notificationRepository,
      PreferenceService preferenceService,
      TemplateRenderer templateRenderer,
      RecipientDirectory recipientDirectory,
      DeliveryRouter deliveryRouter,
      NotificationPayloadCodec payloadCodec,
      NotificationBulkProperties bulkProperties,
      NotificationListingProperties listingProperties,
      NotificationMetrics metrics,
      @Qualifier("deliveryExecutor") TaskExecutor deliveryExecutor,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    this.notificationRepository = notificationRepository;
    this.preferenceService = preferenceService;
    this.templateRenderer = templateRenderer;
    this.recipientDirectory = recipientDirectory;
    this.deliveryRouter = deliveryRouter;
    this.payloadCodec = payloadCodec;
    this.bulkProperties = bulkProperties;
    this.listingProperties = listingProperties;
    this.metrics = metrics;
    this.deliveryExecutor = deliveryExecutor;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.clock = clock;
  }

  /**
   * Creates one notification unless the recipient's preference for the type is disabled.
   *
   * @throws IllegalArgumentException when the recipient, type, title or payload is invalid
   */
  public CreateOutcome create(String recipientId, NotificationDraft draft) {
    requireText(recipientId, "recipientId");
    final NotificationPayload payload = validate(draft);

    try {
      if (!recipientDirectory.exists(recipientId)) {
        logger.warn("notification recipient not found recipientId={}", recipientId);
        return failed(
            recipientId, CreateOutcome.FailureReason.RECIPIENT_NOT_FOUND, "recipient not found");
      }
    } catch (RecipientDirectoryException ex) {
      logger.warn(
          "recipient directory unavailable recipientId={} reason={}", recipientId, ex.reason(), ex);
      return failed(
          recipientId, CreateOutcome.FailureReason.DIRECTORY_UNAVAILABLE, ex.getMessage());
    }

    final NotificationRecord record;
    final DeliveryMethod method;
    try {
      final NotificationPreferenceRecord preferences = preferenceService.getOrCreate(recipientId);
      if (!preferences.isEnabled(draft.notificationType())) {
        logger.debug(
            "notification suppressed by preference recipientId={} type={}",
            recipientId,
            draft.notificationType());
        metrics.recordCreateOutcome("suppressed", 1);
        return new CreateOutcome.Suppressed(
            recipientId,
            draft.notificationType(),
            CreateOutcome.SuppressionReason.PREFERENCE_DISABLED);
      }
      method = preferences.deliveryMethodFor(draft.notificationType());
      final RenderedContent content = render(draft, method);
      record = newRecord(recipientId, draft, payload, content, Instant.now(clock));
      transactionTemplate.executeWithoutResult(status -> notificationRepository.insert(record));
    } catch (DataAccessException ex) {
      logger.error(
          "notification persistence failed recipientId={} type={}",
          recipientId,
          draft.notificationType(),
          ex);
      return failed(
          recipientId,
          CreateOutcome.FailureReason.PERSISTENCE_FAILURE,
          "notification could not be stored");
    }

    metrics.recordCreateOutcome("created", 1);
    logger.info(
        "notification created id={} recipientId={} type={} method={}",
        record.notificationId(),
        recipientId,
        record.notificationType(),
        method.value());
    dispatch(record, method, draft.sendRealTime());
    return new CreateOutcome.Created(record, method);
  }

  /**
   * Creates the same notification for many recipients with one directory call, one preference
   * query and batched inserts in a single transaction. Unknown and gated-out recipients are
   * reported, never fatal.
   *
   * @throws RecipientDirectoryException when the directory cannot resolve the recipients
   * @throws DataAccessException when the batch could not be stored; nothing is kept
   */
  public BulkCreateResult createBulk(Collection<String> recipientIds, NotificationDraft draft) {
    final NotificationPayload payload = validate(draft);
    final Set<String> distinct = new LinkedHashSet<>();
    if (recipientIds != null) {
      recipientIds.stream().filter(id -> id != null && !id.isBlank()).forEach(distinct::add);
    }
    if (distinct.isEmpty()) {
      return BulkCreateResult.empty();
    }

    final Set<String> existing = recipientDirectory.findExisting(distinct);
    final List<String> unknown = distinct.stream().filter(id -> !existing.contains(id)).toList();
    if (!unknown.isEmpty()) {
      logger.warn(
          "bulk notification skipped unknown recipients count={} type={}",
          unknown.size(),
          draft.notificationType());
    }

    final Map<String, NotificationPreferenceRecord> preferences =
        preferenceService.getOrCreateAll(existing);
    final Map<DeliveryMethod, RenderedContent> rendered = new EnumMap<>(DeliveryMethod.class);
    final Map<UUID, DeliveryMethod> methods = new HashMap<>();
    final List<NotificationRecord> records = new ArrayList<>();
    final List<String> suppressed = new ArrayList<>();
    final Instant now = Instant.now(clock);
    for (String recipientId : existing) {
      final NotificationPreferenceRecord preference = preferences.get(recipientId);
      if (preference != null && !preference.isEnabled(draft.notificationType())) {
        suppressed.add(recipientId);
        continue;
      }
      final DeliveryMethod method =
          preference == null
              ? DeliveryMethod.WEBSOCKET
              : preference.deliveryMethodFor(draft.notificationType());
      final RenderedContent content = rendered.computeIfAbsent(method, key -> render(draft, key));
      final NotificationRecord record = newRecord(recipientId, draft, payload, content, now);
      records.add(record);
      methods.put(record.notificationId(), method);
    }

    if (!records.isEmpty()) {
      transactionTemplate.executeWithoutResult(
          status -> {
            for (List<NotificationRecord> chunk :
                Lists.partition(records, bulkProperties.batchSize())) {
              notificationRepository.insertBatch(chunk);
            }
          });
    }

    metrics.recordCreateOutcome("created", records.size());
    metrics.recordCreateOutcome("suppressed", suppressed.size());
    metrics.recordCreateOutcome("recipient_not_found", unknown.size());
    logger.info(
        "bulk notification created type={} created={} suppressed={} unknown={}",
        draft.notificationType(),
        records.size(),
        suppressed.size(),
        unknown.size());
    for (NotificationRecord record : records) {
      dispatch(record, methods.get(record.notificationId()), draft.sendRealTime());
    }
    return new BulkCreateResult(records, suppressed, unknown);
  }

  /**
   * @param limit clamped to [1, max-limit]; null means the configured default
   * @throws IllegalArgumentException when offset is negative
   */
  public NotificationPage list(
      String userId, String notificationType, Boolean read, Integer limit, Integer offset) {
    requireText(userId, "userId");
    final int effectiveOffset = offset == null ? 0 : offset;
    if (effectiveOffset < 0) {
      throw new IllegalArgumentException("offset must not be negative");
    }
    final int effectiveLimit = clampLimit(limit);
    final String type =
        notificationType == null || notificationType.isBlank() ? null : notificationType;
    final List<NotificationRecord> items =
        notificationRepository.findPage(userId, type, read, effectiveLimit, effectiveOffset);
    final int total = notificationRepository.count(userId, type, read);
    final int unread = notificationRepository.countUnread(userId);
    return new NotificationPage(items, total, unread, effectiveLimit, effectiveOffset);
  }

  public int unreadCount(String userId) {
    requireText(userId, "userId");
    return notificationRepository.countUnread(userId);
  }

  /** Returns false when no notification with this id belongs to the user. */
  public boolean delete(UUID notificationId, String userId) {
    requireText(userId, "userId");
    return notificationRepository.deleteByIdAndRecipient(notificationId, userId) > 0;
  }

  @VisibleForTesting
  int clampLimit(Integer limit) {
    if (limit == null) {
      return Math.min(listingProperties.defaultLimit(), listingProperties.maxLimit());
    }
    return Math.max(1, Math.min(limit, listingProperties.maxLimit()));
  }

  private void dispatch(NotificationRecord record, DeliveryMethod method, boolean sendRealTime) {
    try {
      deliveryExecutor.execute(
          () -> {
            try {
              deliveryRouter.route(record, method, sendRealTime);
            } catch (RuntimeException ex) {
              logger.error("notification delivery failed id={}", record.notificationId(), ex);
            }
          });
    } catch (TaskRejectedException ex) {
      logger.warn(
          "notification delivery rejected, executor saturated id={} recipientId={}",
          record.notificationId(),
          record.recipientId(),
          ex);
    }
  }

  private RenderedContent render(NotificationDraft draft, DeliveryMethod method) {
    return templateRenderer.render(
        draft.notificationType(), method, draft.templateContext(), draft.title(), draft.message());
  }

  private NotificationRecord newRecord(
      String recipientId,
      NotificationDraft draft,
      NotificationPayload payload,
      RenderedContent content,
      Instant now) {
    return NotificationRecord.unread(
        UUID.randomUUID(),
        recipientId,
        draft.notificationType(),
        content.title(),
        content.message() == null ? "" : content.message(),
        payload,
        draft.priority(),
        now,
        draft.expiresAt());
  }

  private NotificationPayload validate(NotificationDraft draft) {
    if (draft == null) {
      throw new IllegalArgumentException("notification is required");
    }
    requireText(draft.notificationType(), "notificationType");
    requireText(draft.title(), "title");
    return payloadCodec.normalize(draft.notificationType(), draft.payload());
  }

  private CreateOutcome failed(
      String recipientId, CreateOutcome.FailureReason reason, String message) {
    metrics.recordCreateOutcome(reason.name().toLowerCase(Locale.ROOT), 1);
    return new CreateOutcome.Failed(recipientId, reason, message);
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }
}
