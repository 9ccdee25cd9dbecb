/*
 * Where: Notification service layer (outbound HTTP)
 * What: RecipientDirectory backed by the account service's internal API
 * Why: Transport failures are mapped to RecipientDirectoryException so callers see one type
 */
package com.hirewise.notification.service;

import com.hirewise.notification.config.AccountClientProperties;
import com.hirewise.notification.service.dto.AccountBatchGetRequest;
import com.hirewise.notification.service.dto.AccountBatchGetResponse;
import com.hirewise.notification.service.dto.AccountUserIdsResponse;
import com.hirewise.notification.service.dto.AccountUserResponse;
import java.net.SocketTimeoutException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
@RequiredArgsConstructor
public class AccountDirectoryClient implements RecipientDirectory {

  private final RestClient accountRestClient;
  private final AccountClientProperties properties;

  @Override
  public boolean exists(String userId) {
    if (userId == null || userId.isBlank()) {
      return false;
    }
    try {
      final AccountUserResponse response =
          call(
              () ->
                  accountRestClient
                      .get()
                      .uri(properties.getUserPath(), userId)
                      .header(properties.internalApiHeaderName(), properties.internalApiToken())
                      .retrieve()
                      .body(AccountUserResponse.class));
      return response != null && userId.equals(response.userId());
    } catch (RecipientDirectoryException ex) {
      if (ex.reason() == RecipientDirectoryException.Reason.NOT_FOUND) {
        return false;
      }
      throw ex;
    }
  }

  @Override
  public Set<String> findExisting(Collection<String> userIds) {
    final Set<String> found = new LinkedHashSet<>();
    if (userIds == null || userIds.isEmpty()) {
      return found;
    }
    final AccountBatchGetResponse response =
        call(
            () ->
                accountRestClient
                    .post()
                    .uri(properties.batchGetUsersPath())
                    .header(properties.internalApiHeaderName(), properties.internalApiToken())
                    .body(new AccountBatchGetRequest(List.copyOf(userIds)))
                    .retrieve()
                    .body(AccountBatchGetResponse.class));
    if (response == null) {
      throw new RecipientDirectoryException(
          RecipientDirectoryException.Reason.INVALID_RESPONSE, "account batch response is empty");
    }
    response.users().stream()
        .filter(Objects::nonNull)
        .map(AccountUserResponse::userId)
        .filter(userIds::contains)
        .forEach(found::add);
    return found;
  }

  @Override
  public List<String> listActiveUserIds(String role) {
    final AccountUserIdsResponse response =
        call(
            () ->
                accountRestClient
                    .get()
                    .uri(properties.listUsersPath(), role)
                    .header(properties.internalApiHeaderName(), properties.internalApiToken())
                    .retrieve()
                    .body(AccountUserIdsResponse.class));
    return response == null ? List.of() : response.userIds();
  }

  private <T> T call(Supplier<T> request) {
    try {
      return request.get();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    } catch (RuntimeException ex) {
      throw new RecipientDirectoryException(
          RecipientDirectoryException.Reason.INVALID_RESPONSE, "account response parse failed", ex);
    }
  }

  private RecipientDirectoryException mapResponseException(RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    if (status == 401 || status == 403) {
      return new RecipientDirectoryException(
          RecipientDirectoryException.Reason.UNAUTHORIZED, "account rejected internal auth", ex);
    }
    if (status == 404) {
      return new RecipientDirectoryException(
          RecipientDirectoryException.Reason.NOT_FOUND, "account user not found", ex);
    }
    return new RecipientDirectoryException(
        RecipientDirectoryException.Reason.BAD_GATEWAY, "account request failed status=" + status, ex);
  }

  private RecipientDirectoryException mapResourceException(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return new RecipientDirectoryException(
            RecipientDirectoryException.Reason.TIMEOUT, "account request timeout", ex);
      }
      current = current.getCause();
    }
    return new RecipientDirectoryException(
        RecipientDirectoryException.Reason.BAD_GATEWAY, "account connection failed", ex);
  }
}
