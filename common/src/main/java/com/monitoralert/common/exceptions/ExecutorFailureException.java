package com.monitoralert.common.exceptions;

import java.time.Duration;

/**
 * Notification dispatch for one action failed or timed out.
 */
public class ExecutorFailureException extends RuntimeException {

    private ExecutorFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ExecutorFailureException timeout(String actionId, Duration timeout) {
        return new ExecutorFailureException(
                "Action " + actionId + " did not complete within " + timeout.toMillis() + " ms", null);
    }

    public static ExecutorFailureException of(String actionId, Throwable cause) {
        return new ExecutorFailureException("Action " + actionId + " failed: " + cause.getMessage(), cause);
    }
}
