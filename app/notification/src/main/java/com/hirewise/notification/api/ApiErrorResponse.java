package com.hirewise.notification.api;

/** Error body shared by every endpoint. */
public record ApiErrorResponse(String code, String message) {}
