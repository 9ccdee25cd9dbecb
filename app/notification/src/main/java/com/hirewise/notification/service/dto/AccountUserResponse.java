package com.hirewise.notification.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AccountUserResponse(String userId, String status, List<String> roles) {

  public AccountUserResponse {
    roles = roles == null ? List.of() : List.copyOf(roles);
  }
}
