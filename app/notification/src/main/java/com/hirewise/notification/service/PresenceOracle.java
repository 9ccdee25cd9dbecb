package com.hirewise.notification.service;

/** Answers whether a recipient currently holds a live session on the connection gateway. */
public interface PresenceOracle {

  boolean isReachable(String recipientId);
}
