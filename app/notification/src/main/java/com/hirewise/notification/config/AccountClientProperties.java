/*
 * Where: Notification configuration
 * What: Account service endpoint and internal auth header used to resolve recipients
 */
package com.hirewise.notification.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "account")
public record AccountClientProperties(
    String baseUrl,
    String internalApiToken,
    String internalApiHeaderName,
    String getUserPath,
    String batchGetUsersPath,
    String listUsersPath) {

  public AccountClientProperties {
    baseUrl = baseUrl == null ? "http://account:80" : baseUrl;
    internalApiToken = internalApiToken == null ? "" : internalApiToken;
    internalApiHeaderName =
        internalApiHeaderName == null || internalApiHeaderName.isBlank()
            ? "X-Internal-Token"
            : internalApiHeaderName;
    getUserPath = getUserPath == null || getUserPath.isBlank() ? "/users/{userId}" : getUserPath;
    batchGetUsersPath =
        batchGetUsersPath == null || batchGetUsersPath.isBlank()
            ? "/users:batch-get"
            : batchGetUsersPath;
    listUsersPath =
        listUsersPath == null || listUsersPath.isBlank()
            ? "/users?role={role}&status=active"
            : listUsersPath;
  }
}
