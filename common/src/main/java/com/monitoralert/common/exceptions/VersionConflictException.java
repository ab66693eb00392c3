package com.monitoralert.common.exceptions;

/**
 * A concurrent writer changed the record since the caller read it.
 * The caller must reload a fresh snapshot and retry.
 */
public class VersionConflictException extends RuntimeException {

    private VersionConflictException(String message) {
        super(message);
    }

    private VersionConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    public static VersionConflictException of(String id, long expectedVersion, long actualVersion) {
        return new VersionConflictException(
                "Version conflict on " + id + ": expected " + expectedVersion + ", found " + actualVersion);
    }

    public static VersionConflictException alreadyExists(String id) {
        return new VersionConflictException("Version conflict on " + id + ": record already exists");
    }

    public static VersionConflictException concurrentWrite(String id, Throwable cause) {
        return new VersionConflictException("Version conflict on " + id + ": concurrent write detected", cause);
    }
}
