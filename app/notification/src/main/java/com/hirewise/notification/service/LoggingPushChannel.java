/*
 * Where: Notification service layer
 * What: Push channel used when NATS is disabled
 * Why: Local runs and tests start without a NATS server
 */
package com.hirewise.notification.service;

import com.hirewise.notification.model.event.PushEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class LoggingPushChannel implements PushChannel {

  private static final Logger logger = LoggerFactory.getLogger(LoggingPushChannel.class);

  @Override
  public void publish(String recipientId, PushEvent event) {
    logger.info("push event not published (nats disabled) recipientId={} type={}", recipientId, event.type());
  }
}
