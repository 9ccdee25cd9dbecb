package com.hirewise.notification.nats;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hirewise.notification.config.NotificationPresenceNatsProperties;
import com.hirewise.notification.service.DrainResult;
import com.hirewise.notification.service.OfflineQueueService;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.Message;
import io.nats.client.MessageHandler;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PresenceEventSubscriberTest {

  private static final String SUBJECT = "presence.events";
  private static final String QUEUE_GROUP = "notification-presence";

  @Mock private Connection connection;
  @Mock private Dispatcher dispatcher;
  @Mock private OfflineQueueService offlineQueueService;

  private PresenceEventSubscriber subscriber;

  @BeforeEach
  void setUp() {
    subscriber =
        new PresenceEventSubscriber(
            connection,
            new ObjectMapper().registerModule(new JavaTimeModule()),
            offlineQueueService,
            new NotificationPresenceNatsProperties(SUBJECT, QUEUE_GROUP));
  }

  @Test
  void startSubscribesWithQueueGroupOnce() {
    when(connection.createDispatcher(any(MessageHandler.class))).thenReturn(dispatcher);

    subscriber.start();
    subscriber.start();

    verify(connection, times(1)).createDispatcher(any(MessageHandler.class));
    verify(dispatcher).subscribe(SUBJECT, QUEUE_GROUP);
  }

  @Test
  void stopClosesDispatcherOnce() {
    when(connection.createDispatcher(any(MessageHandler.class))).thenReturn(dispatcher);
    subscriber.start();

    subscriber.stop();
    subscriber.stop();

    verify(connection, times(1)).closeDispatcher(dispatcher);
  }

  @Test
  void connectedEventDrainsBacklog() {
    when(offlineQueueService.drain("user-1")).thenReturn(new DrainResult(2, 2, 0));

    subscriber.handleMessage(
        message(
            "{\"user_id\":\"user-1\",\"status\":\"connected\",\"occurred_at\":\"2026-03-01T09:00:00Z\"}"));

    verify(offlineQueueService).drain("user-1");
  }

  @Test
  void disconnectedEventIsIgnored() {
    subscriber.handleMessage(message("{\"user_id\":\"user-1\",\"status\":\"disconnected\"}"));

    verify(offlineQueueService, never()).drain(anyString());
  }

  @Test
  void unreadablePayloadIsDropped() {
    subscriber.handleMessage(message("{not-json"));

    verify(offlineQueueService, never()).drain(anyString());
  }

  @Test
  void drainFailureDoesNotEscapeTheDispatcher() {
    doThrow(new IllegalStateException("redis down")).when(offlineQueueService).drain("user-1");

    subscriber.handleMessage(message("{\"user_id\":\"user-1\",\"status\":\"connected\"}"));

    verify(offlineQueueService).drain("user-1");
  }

  private Message message(String json) {
    final Message message = mock(Message.class);
    when(message.getData()).thenReturn(json.getBytes(StandardCharsets.UTF_8));
    return message;
  }
}
