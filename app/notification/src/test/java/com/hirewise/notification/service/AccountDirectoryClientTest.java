package com.hirewise.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.hirewise.notification.config.AccountClientProperties;
import java.net.SocketTimeoutException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class AccountDirectoryClientTest {

  @Test
  void existsCallsAccountWithInternalHeader() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://account.test/users/user-1"))
        .andExpect(method(GET))
        .andExpect(header("X-Internal-Token", "token-x"))
        .andRespond(
            withSuccess(
                """
                {"user_id":"user-1","status":"active","roles":["job_seeker"]}
                """,
                MediaType.APPLICATION_JSON));

    assertThat(fixture.client.exists("user-1")).isTrue();
    fixture.server.verify();
  }

  @Test
  void existsIsFalseOn404() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://account.test/users/ghost"))
        .andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertThat(fixture.client.exists("ghost")).isFalse();
  }

  @Test
  void existsMaps401ToUnauthorized() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://account.test/users/user-1"))
        .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertThatThrownBy(() -> fixture.client.exists("user-1"))
        .isInstanceOf(RecipientDirectoryException.class)
        .extracting(ex -> ((RecipientDirectoryException) ex).reason())
        .isEqualTo(RecipientDirectoryException.Reason.UNAUTHORIZED);
  }

  @Test
  void existsMapsTimeout() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://account.test/users/user-1"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timed out", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(() -> fixture.client.exists("user-1"))
        .isInstanceOf(RecipientDirectoryException.class)
        .extracting(ex -> ((RecipientDirectoryException) ex).reason())
        .isEqualTo(RecipientDirectoryException.Reason.TIMEOUT);
  }

  @Test
  void findExistingReturnsOnlyRequestedIdsTheAccountKnows() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://account.test/users:batch-get"))
        .andExpect(method(POST))
        .andExpect(content().json("{\"user_ids\":[\"a\",\"b\",\"c\"]}"))
        .andRespond(
            withSuccess(
                """
                {"users":[{"user_id":"a","status":"active"},{"user_id":"c","status":"active"},
                          {"user_id":"zzz","status":"active"}]}
                """,
                MediaType.APPLICATION_JSON));

    assertThat(fixture.client.findExisting(List.of("a", "b", "c"))).containsExactly("a", "c");
    fixture.server.verify();
  }

  @Test
  void findExistingMaps5xxToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://account.test/users:batch-get"))
        .andRespond(withServerError());

    assertThatThrownBy(() -> fixture.client.findExisting(List.of("a")))
        .isInstanceOf(RecipientDirectoryException.class)
        .extracting(ex -> ((RecipientDirectoryException) ex).reason())
        .isEqualTo(RecipientDirectoryException.Reason.BAD_GATEWAY);
  }

  @Test
  void listActiveUserIdsQueriesByRole() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://account.test/users?role=job_seeker&status=active"))
        .andExpect(method(GET))
        .andRespond(
            withSuccess("{\"user_ids\":[\"s1\",\"s2\"]}", MediaType.APPLICATION_JSON));

    assertThat(fixture.client.listActiveUserIds("job_seeker")).containsExactly("s1", "s2");
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://account.test").build();
    final AccountClientProperties properties =
        new AccountClientProperties("http://account.test", "token-x", "X-Internal-Token", null, null, null);
    return new ClientFixture(new AccountDirectoryClient(restClient, properties), server);
  }

  private record ClientFixture(AccountDirectoryClient client, MockRestServiceServer server) {}
}
