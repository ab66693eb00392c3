package com.monitoralert.common.exceptions;

public class MonitorNotFoundException extends RuntimeException {

    private MonitorNotFoundException(String message) {
        super(message);
    }

    public static MonitorNotFoundException of(String monitorId) {
        return new MonitorNotFoundException("Monitor not found: " + monitorId);
    }
}
