package com.hirewise.notification.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AccountBatchGetRequest(List<String> userIds) {

  public AccountBatchGetRequest {
    userIds = userIds == null ? List.of() : List.copyOf(userIds);
  }
}
