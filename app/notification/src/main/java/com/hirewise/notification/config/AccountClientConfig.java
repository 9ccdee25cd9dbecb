package com.hirewise.notification.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class AccountClientConfig {

  @Bean
  RestClient accountRestClient(RestClient.Builder builder, AccountClientProperties properties) {
    // Dedicated client for recipient lookups against the account service.
    return builder.baseUrl(properties.baseUrl()).build();
  }
}
