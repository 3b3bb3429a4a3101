package com.whereq.orbit.exception;

/**
 * Thrown when a desired spec is malformed (bad accelerator syntax, reserved queue name).
 * Never retried: the resource fails immediately
 */
public class ResourceValidationException extends RuntimeException {
    public ResourceValidationException(String message) {
        super(message);
    }

    public ResourceValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
