/*
 * Where: Notification infrastructure
 * What: Bounded executor that runs delivery after the create transaction commits
 * Why: Slow push or Redis calls must not hold up the create call
 */
package com.hirewise.notification.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class DeliveryExecutorConfig {

  @Bean
  TaskExecutor deliveryExecutor(NotificationDeliveryProperties properties) {
    final NotificationDeliveryProperties.Executor settings = properties.executor();
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("notification-delivery-");
    executor.setCorePoolSize(settings.corePoolSize());
    executor.setMaxPoolSize(Math.max(settings.corePoolSize(), settings.maxPoolSize()));
    executor.setQueueCapacity(settings.queueCapacity());
    // Rejected tasks surface to the caller, which logs them; the row stays listable.
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
