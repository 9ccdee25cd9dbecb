package com.hirewise.notification.service;

public class RecipientDirectoryException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    UNAUTHORIZED,
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public RecipientDirectoryException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public RecipientDirectoryException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
