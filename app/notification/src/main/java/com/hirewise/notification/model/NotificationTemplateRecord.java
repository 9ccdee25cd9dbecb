/*
 * Where: Notification domain model
 * What: Title/message template for one (type, delivery method) key
 */
package com.hirewise.notification.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationTemplateRecord(
    UUID templateId,
    String notificationType,
    DeliveryMethod deliveryMethod,
    String titleTemplate,
    String messageTemplate,
    boolean active,
    Instant createdAt) {}
