package com.hirewise.notification.service;

/** Raised when an event could not be handed to a recipient's push channel. */
public class PushDeliveryException extends RuntimeException {

  public PushDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
