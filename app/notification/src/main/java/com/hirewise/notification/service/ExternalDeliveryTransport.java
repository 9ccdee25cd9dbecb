package com.hirewise.notification.service;

import com.hirewise.notification.model.DeliveryMethod;
import com.hirewise.notification.model.NotificationRecord;

/**
 * Hand-off point to out-of-band transports (email, mobile push). Implementations must return
 * quickly; the router treats every call as fire-and-forget.
 */
public interface ExternalDeliveryTransport {

  void signal(DeliveryMethod channel, NotificationRecord notification);
}
