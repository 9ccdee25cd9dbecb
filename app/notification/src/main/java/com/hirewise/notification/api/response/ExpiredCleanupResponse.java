package com.hirewise.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** count is the number deleted, or the number that would be deleted on a dry run. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExpiredCleanupResponse(boolean dryRun, int count) {}
