package com.hirewise.notification.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class DeliveryMethodTest {

  @Test
  void bothMeansLiveChannelPlusEmail() {
    assertThat(DeliveryMethod.BOTH.includesLiveChannel()).isTrue();
    assertThat(DeliveryMethod.BOTH.externalChannels()).containsExactly(DeliveryMethod.EMAIL);
    assertThat(DeliveryMethod.BOTH.templateChannel()).isEqualTo(DeliveryMethod.WEBSOCKET);
  }

  @Test
  void pushAndEmailSkipTheLiveChannel() {
    assertThat(DeliveryMethod.PUSH.includesLiveChannel()).isFalse();
    assertThat(DeliveryMethod.PUSH.externalChannels()).containsExactly(DeliveryMethod.PUSH);
    assertThat(DeliveryMethod.EMAIL.includesLiveChannel()).isFalse();
    assertThat(DeliveryMethod.WEBSOCKET.externalChannels()).isEmpty();
  }

  @Test
  void parsesWireValuesIgnoringCase() {
    assertThat(DeliveryMethod.fromValue(" Email ")).isEqualTo(DeliveryMethod.EMAIL);
    assertThatThrownBy(() -> DeliveryMethod.fromValue("sms"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void blankPriorityDefaultsToNormal() {
    assertThat(NotificationPriority.fromValue(null)).isEqualTo(NotificationPriority.NORMAL);
    assertThat(NotificationPriority.fromValue("URGENT")).isEqualTo(NotificationPriority.URGENT);
    assertThatThrownBy(() -> NotificationPriority.fromValue("critical"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
