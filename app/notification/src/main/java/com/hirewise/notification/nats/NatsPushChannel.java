/*
 * Where: Notification messaging (NATS)
 * What: Publishes push events as JSON to the recipient's core NATS subject
 * Why: The gateway subscribes per connected user and relays to websocket sessions
 */
package com.hirewise.notification.nats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hirewise.notification.config.NotificationDeliveryProperties;
import com.hirewise.notification.model.event.PushEvent;
import com.hirewise.notification.service.PushChannel;
import com.hirewise.notification.service.PushDeliveryException;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.Connection;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "NATS Connection and ObjectMapper are shared Spring-managed components")
public class NatsPushChannel implements PushChannel {

  private final Connection connection;
  private final ObjectMapper objectMapper;
  private final NotificationDeliveryProperties properties;

  public NatsPushChannel(
      Connection connection,
      ObjectMapper objectMapper,
      NotificationDeliveryProperties properties) {
    this.connection = connection;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public void publish(String recipientId, PushEvent event) {
    final byte[] body;
    try {
      body = objectMapper.writeValueAsBytes(event);
    } catch (JsonProcessingException ex) {
      throw new PushDeliveryException("failed to serialize push event type=" + event.type(), ex);
    }
    try {
      connection.publish(properties.subjectFor(recipientId), body);
    } catch (IllegalStateException | IllegalArgumentException ex) {
      // jnats reports a closed connection or an invalid subject this way.
      throw new PushDeliveryException("failed to publish push event type=" + event.type(), ex);
    }
  }
}
