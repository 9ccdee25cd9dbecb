package com.hirewise.notification.api;

import com.hirewise.notification.service.CreateOutcome;

/** Carries a Failed create outcome to the exception handler. */
public class NotificationCreateFailedException extends RuntimeException {

  private final CreateOutcome.FailureReason reason;

  public NotificationCreateFailedException(CreateOutcome.Failed failed) {
    super(failed.message());
    this.reason = failed.reason();
  }

  public CreateOutcome.FailureReason reason() {
    return reason;
  }
}
