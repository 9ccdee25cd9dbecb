package com.hirewise.notification.service.dto;

import java.util.List;

public record AccountBatchGetResponse(List<AccountUserResponse> users) {

  public AccountBatchGetResponse {
    users = users == null ? List.of() : List.copyOf(users);
  }
}
