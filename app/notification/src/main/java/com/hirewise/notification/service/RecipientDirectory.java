/*
 * Where: Notification service layer
 * What: Identity lookups needed before a notification is created
 * Why: Recipients are owned by the account service; the engine never stores users
 */
package com.hirewise.notification.service;

import java.util.Collection;
import java.util.List;
import java.util.Set;

public interface RecipientDirectory {

  /**
   * @throws RecipientDirectoryException when the directory cannot answer
   */
  boolean exists(String userId);

  /** Subset of the given ids that resolve to a user, resolved in one call. */
  Set<String> findExisting(Collection<String> userIds);

  /** Ids of active users holding the role, e.g. every job seeker for a job broadcast. */
  List<String> listActiveUserIds(String role);
}
