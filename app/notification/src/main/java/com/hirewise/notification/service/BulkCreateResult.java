package com.hirewise.notification.service;

import com.hirewise.notification.model.NotificationRecord;
import java.util.List;

/** Recipients are partitioned into created, gated out and unknown; nothing else happens. */
public record BulkCreateResult(
    List<NotificationRecord> created,
    List<String> suppressedRecipientIds,
    List<String> unknownRecipientIds) {

  public BulkCreateResult {
    created = List.copyOf(created);
    suppressedRecipientIds = List.copyOf(suppressedRecipientIds);
    unknownRecipientIds = List.copyOf(unknownRecipientIds);
  }

  public static BulkCreateResult empty() {
    return new BulkCreateResult(List.of(), List.of(), List.of());
  }
}
