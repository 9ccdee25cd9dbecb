package com.hirewise.notification.api;

import com.hirewise.notification.api.request.UpdatePreferencesRequest;
import com.hirewise.notification.api.response.PreferencesResponse;
import com.hirewise.notification.config.RequestMdcInterceptor;
import com.hirewise.notification.service.PreferenceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/notification-preferences")
@RequiredArgsConstructor
public class NotificationPreferenceController {

  private static final String HEADER_USER_ID = RequestMdcInterceptor.USER_ID_HEADER;

  private final PreferenceService preferenceService;

  @GetMapping
  public ResponseEntity<PreferencesResponse> get(@RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(PreferencesResponse.from(preferenceService.getOrCreate(userId)));
  }

  @PutMapping
  public ResponseEntity<PreferencesResponse> update(
      @RequestHeader(HEADER_USER_ID) String userId, @RequestBody UpdatePreferencesRequest request) {
    return ResponseEntity.ok(
        PreferencesResponse.from(preferenceService.update(userId, request.toUpdate())));
  }
}
