/*
 * Where: Push channel contract
 * What: Common shape of events published to a user's channel
 */
package com.hirewise.notification.model.event;

import com.fasterxml.jackson.annotation.JsonProperty;

public interface PushEvent {

  @JsonProperty("type")
  String type();
}
