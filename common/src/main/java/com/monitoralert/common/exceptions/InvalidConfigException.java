package com.monitoralert.common.exceptions;

/**
 * Throttle, template or trigger misconfiguration. Rejects the write that carried it.
 */
public class InvalidConfigException extends ParseException {

    private InvalidConfigException(String message) {
        super(message);
    }

    public static InvalidConfigException of(String message) {
        return new InvalidConfigException(message);
    }

    public static InvalidConfigException throttleNotConfigured(String actionName) {
        return new InvalidConfigException(
                "Action " + actionName + ": throttle enabled but not configured");
    }

    public static InvalidConfigException wrongLanguage(String field, String expected, String actual) {
        return new InvalidConfigException(
                field + " must be a " + expected + " script, got: " + actual);
    }
}
