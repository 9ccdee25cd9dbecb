package com.hirewise.notification.service;

/** total entries taken from the backlog; delivered + failed == total. */
public record DrainResult(int total, int delivered, int failed) {

  public static DrainResult empty() {
    return new DrainResult(0, 0, 0);
  }
}
