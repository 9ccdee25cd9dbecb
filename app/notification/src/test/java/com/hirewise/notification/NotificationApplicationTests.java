package com.hirewise.notification;

import static org.assertj.core.api.Assertions.assertThat;

import com.hirewise.notification.repository.InMemoryOfflineNotificationQueue;
import com.hirewise.notification.repository.OfflineNotificationQueue;
import com.hirewise.notification.service.LoggingPushChannel;
import com.hirewise.notification.service.PushChannel;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private PushChannel pushChannel;
  @Autowired private OfflineNotificationQueue offlineQueue;

  @Test
  void contextLoadsWithLocalFallbacksWhenNatsIsDisabled() {
    assertThat(pushChannel).isInstanceOf(LoggingPushChannel.class);
    assertThat(offlineQueue).isInstanceOf(InMemoryOfflineNotificationQueue.class);
  }
}
