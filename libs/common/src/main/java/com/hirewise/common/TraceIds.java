package com.hirewise.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** Returns {@code candidate} when it carries a value, otherwise a fresh id. */
  public static String orNew(String candidate) {
    if (candidate != null && !candidate.isBlank()) {
      return candidate.trim();
    }
    return newTraceId();
  }
}
