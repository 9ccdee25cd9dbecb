package com.hirewise.notification.service;

import com.hirewise.notification.model.DeliveryMethod;
import java.util.Set;

public record DeliveryOutcome(boolean pushed, boolean queued, Set<DeliveryMethod> externalChannels) {

  public DeliveryOutcome {
    externalChannels = Set.copyOf(externalChannels);
  }
}
