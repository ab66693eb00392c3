package com.monitoralert.common.exceptions;

/**
 * A malformed or semantically invalid monitor document, action definition or binary record.
 * Fatal for the record being read; nothing is partially applied.
 */
public class ParseException extends RuntimeException {

    protected ParseException(String message) {
        super(message);
    }

    protected ParseException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ParseException unexpectedField(String field, String context) {
        return new ParseException("Unexpected field: " + field + ", while parsing " + context);
    }

    public static ParseException missingField(String field, String context) {
        return new ParseException("Missing required field: " + field + ", while parsing " + context);
    }

    public static ParseException invalidValue(String field, String expected) {
        return new ParseException("Invalid value for " + field + ": expected " + expected);
    }

    public static ParseException malformed(String context, Throwable cause) {
        return new ParseException("Malformed " + context + ": " + cause.getMessage(), cause);
    }
}
