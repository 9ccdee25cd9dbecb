/*
 * Where: Notification service layer
 * What: Loads recipient preferences, creating all-enabled defaults on first use
 * Why: Gating needs a row for every recipient, including users who never opened settings
 */
package com.hirewise.notification.service;

import com.google.common.collect.Lists;
import com.hirewise.notification.config.NotificationBulkProperties;
import com.hirewise.notification.model.DeliveryMethod;
import com.hirewise.notification.model.KnownNotificationType;
import com.hirewise.notification.model.NotificationPreferenceRecord;
import com.hirewise.notification.repository.NotificationPreferenceRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PreferenceService {

  private static final Logger logger = LoggerFactory.getLogger(PreferenceService.class);

  private final NotificationPreferenceRepository preferenceRepository;
  private final NotificationBulkProperties bulkProperties;
  private final Clock clock;

  public NotificationPreferenceRecord getOrCreate(String recipientId) {
    return preferenceRepository
        .findByRecipientId(recipientId)
        .orElseGet(() -> createDefaults(recipientId));
  }

  /**
   * One SELECT per batch of recipients plus one batch INSERT for those without a row. Batches
   * follow notification.bulk.batch-size so the IN list stays bounded.
   */
  public Map<String, NotificationPreferenceRecord> getOrCreateAll(Collection<String> recipientIds) {
    final Set<String> wanted = new LinkedHashSet<>(recipientIds);
    final Map<String, NotificationPreferenceRecord> found = findAll(List.copyOf(wanted));
    final Instant now = Instant.now(clock);
    final List<NotificationPreferenceRecord> missing =
        wanted.stream()
            .filter(id -> !found.containsKey(id))
            .map(id -> NotificationPreferenceRecord.defaults(id, now))
            .toList();
    if (missing.isEmpty()) {
      return found;
    }
    final int inserted = preferenceRepository.insertIfAbsent(missing);
    if (inserted < missing.size()) {
      // Someone else created some of these rows concurrently; their values win.
      found.putAll(
          findAll(missing.stream().map(NotificationPreferenceRecord::recipientId).toList()));
    }
    for (NotificationPreferenceRecord defaults : missing) {
      found.putIfAbsent(defaults.recipientId(), defaults);
    }
    logger.debug("materialized default preferences count={}", missing.size());
    return found;
  }

  public NotificationPreferenceRecord update(String recipientId, PreferenceUpdate update) {
    final NotificationPreferenceRecord current = getOrCreate(recipientId);
    final Map<KnownNotificationType, Boolean> gates = new EnumMap<>(KnownNotificationType.class);
    gates.putAll(current.gates());
    update.gates().forEach(gates::put);
    final Map<String, DeliveryMethod> overrides = new LinkedHashMap<>(current.deliveryOverrides());
    overrides.putAll(update.deliveryOverrides());
    final NotificationPreferenceRecord updated =
        new NotificationPreferenceRecord(
            recipientId,
            gates,
            update.defaultDeliveryMethod() == null
                ? current.defaultDeliveryMethod()
                : update.defaultDeliveryMethod(),
            overrides,
            current.createdAt(),
            Instant.now(clock));
    preferenceRepository.upsert(updated);
    return updated;
  }

  private Map<String, NotificationPreferenceRecord> findAll(List<String> recipientIds) {
    final Map<String, NotificationPreferenceRecord> found = new LinkedHashMap<>();
    for (List<String> batch : Lists.partition(recipientIds, bulkProperties.batchSize())) {
      found.putAll(preferenceRepository.findByRecipientIds(batch));
    }
    return found;
  }

  private NotificationPreferenceRecord createDefaults(String recipientId) {
    final NotificationPreferenceRecord defaults =
        NotificationPreferenceRecord.defaults(recipientId, Instant.now(clock));
    if (preferenceRepository.insertIfAbsent(List.of(defaults)) == 0) {
      return preferenceRepository.findByRecipientId(recipientId).orElse(defaults);
    }
    return defaults;
  }
}
