package com.hirewise.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.listing")
@Validated
public record NotificationListingProperties(@Positive int defaultLimit, @Positive int maxLimit) {

  @AssertTrue(message = "notification.listing.default-limit must not exceed max-limit")
  public boolean isDefaultWithinMax() {
    return defaultLimit <= maxLimit;
  }
}
