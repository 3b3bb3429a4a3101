package com.whereq.orbit.exception;

/**
 * Optimistic concurrency collision on a status write; re-read and retry
 */
public class ResourceConflictException extends RuntimeException {
    public ResourceConflictException(String message) {
        super(message);
    }

    public ResourceConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
