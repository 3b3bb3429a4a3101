package com.whereq.orbit.exception;

/**
 * Thrown when (owner, namespace, name) is already taken
 */
public class DuplicateResourceException extends RuntimeException {
    public DuplicateResourceException(String message) {
        super(message);
    }

    public DuplicateResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
