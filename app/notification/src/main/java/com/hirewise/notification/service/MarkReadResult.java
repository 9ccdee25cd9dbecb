package com.hirewise.notification.service;

public enum MarkReadResult {
  MARKED,
  ALREADY_READ,
  NOT_FOUND
}
