/*
 * Where: Notification messaging (NATS)
 * What: Listens for gateway presence events and drains the backlog when a user connects
 * Why: The queue group makes exactly one engine instance replay a given reconnect
 */
package com.hirewise.notification.nats;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hirewise.notification.config.NotificationPresenceNatsProperties;
import com.hirewise.notification.model.event.PresenceEvent;
import com.hirewise.notification.service.OfflineQueueService;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.Message;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class PresenceEventSubscriber {

  private static final Logger logger = LoggerFactory.getLogger(PresenceEventSubscriber.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "NATS Connection is an externally managed shared resource")
  private final Connection connection;

  private final ObjectMapper objectMapper;
  private final OfflineQueueService offlineQueueService;
  private final NotificationPresenceNatsProperties properties;
  private final AtomicBoolean started;
  private Dispatcher dispatcher;

  public PresenceEventSubscriber(
      Connection connection,
      ObjectMapper objectMapper,
      OfflineQueueService offlineQueueService,
      NotificationPresenceNatsProperties properties) {
    this.connection = connection;
    this.objectMapper = objectMapper;
    this.offlineQueueService = offlineQueueService;
    this.properties = properties;
    this.started = new AtomicBoolean(false);
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    dispatcher = connection.createDispatcher(this::handleMessage);
    dispatcher.subscribe(properties.subject(), properties.queueGroup());
    logger.info(
        "presence subscriber started subject={} queueGroup={}",
        properties.subject(),
        properties.queueGroup());
  }

  @PreDestroy
  public void stop() {
    if (dispatcher != null) {
      connection.closeDispatcher(dispatcher);
      dispatcher = null;
    }
    started.set(false);
  }

  void handleMessage(Message message) {
    final PresenceEvent event;
    try {
      event = objectMapper.readValue(message.getData(), PresenceEvent.class);
    } catch (IOException ex) {
      logger.warn("dropping unreadable presence event subject={}", message.getSubject(), ex);
      return;
    }
    if (event.userId() == null || event.userId().isBlank() || !event.isConnected()) {
      return;
    }
    try {
      offlineQueueService.drain(event.userId());
    } catch (RuntimeException ex) {
      logger.error("offline backlog drain failed userId={}", event.userId(), ex);
    }
  }
}
