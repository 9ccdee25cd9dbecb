/*
 * Where: Notification service layer
 * What: Per-recipient live channel the gateway relays to websocket sessions
 */
package com.hirewise.notification.service;

import com.hirewise.notification.model.event.PushEvent;

public interface PushChannel {

  /**
   * Publishes one event to the recipient's channel.
   *
   * @throws PushDeliveryException when the event could not be handed off
   */
  void publish(String recipientId, PushEvent event);
}
