package com.hirewise.notification.service;

import com.hirewise.notification.model.DeliveryMethod;
import com.hirewise.notification.model.NotificationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingExternalDeliveryTransport implements ExternalDeliveryTransport {

  private static final Logger logger =
      LoggerFactory.getLogger(LoggingExternalDeliveryTransport.class);

  @Override
  public void signal(DeliveryMethod channel, NotificationRecord notification) {
    logger.info(
        "external delivery requested channel={} notificationId={} recipientId={} type={}",
        channel.value(),
        notification.notificationId(),
        notification.recipientId(),
        notification.notificationType());
  }
}
