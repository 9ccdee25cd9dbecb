package com.hirewise.notification.api;

import com.hirewise.notification.api.response.ExpiredCleanupResponse;
import com.hirewise.notification.service.NotificationExpirationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/notifications")
@RequiredArgsConstructor
public class NotificationAdminController {

  private final NotificationExpirationService expirationService;

  /** dry_run=true only counts what the sweep would delete. */
  @PostMapping("/expired/cleanup")
  public ResponseEntity<ExpiredCleanupResponse> cleanupExpired(
      @RequestParam(name = "dry_run", defaultValue = "false") boolean dryRun) {
    final int count =
        dryRun ? expirationService.countExpired() : expirationService.deleteExpired();
    return ResponseEntity.ok(new ExpiredCleanupResponse(dryRun, count));
  }
}
