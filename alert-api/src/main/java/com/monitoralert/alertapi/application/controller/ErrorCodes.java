package com.monitoralert.alertapi.application.controller;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ErrorCodes {

    public static final String INVALID_MONITOR = "INVALID_MONITOR";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String MONITOR_NOT_FOUND = "MONITOR_NOT_FOUND";
    public static final String VERSION_CONFLICT = "VERSION_CONFLICT";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
}
