/*
 * Where: Notification application configuration binding
 * What: Push channel addressing, fallback policy and the delivery executor pool
 * Why: Keep delivery tuning outside the code
 */
package com.hirewise.notification.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.delivery")
@Validated
public record NotificationDeliveryProperties(
    @NotBlank String userSubjectPrefix,
    boolean enqueueOnPushFailure,
    @NotNull @Valid Executor executor) {

  public String subjectFor(String userId) {
    return userSubjectPrefix + userId;
  }

  public record Executor(
      @Positive int corePoolSize, @Positive int maxPoolSize, @PositiveOrZero int queueCapacity) {}
}
