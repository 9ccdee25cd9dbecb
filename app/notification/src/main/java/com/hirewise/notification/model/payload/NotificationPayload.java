/*
 * Where: Notification domain model
 * What: Typed payload stored in the notifications.data column
 * Why: Each known notification_type has exactly one payload shape; consumers branch on the
 *      concrete record instead of probing a map
 */
package com.hirewise.notification.model.payload;

public sealed interface NotificationPayload
    permits JobPostedPayload,
        ApplicationReceivedPayload,
        ApplicationStatusChangedPayload,
        MatchScoreCalculatedPayload,
        InterviewScheduledPayload,
        MessageReceivedPayload,
        SystemUpdatePayload,
        GenericPayload {}
