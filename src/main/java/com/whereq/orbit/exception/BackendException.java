package com.whereq.orbit.exception;

/**
 * Transient placement backend failure (network, provider API).
 * Retried with bounded exponential backoff
 */
public class BackendException extends RuntimeException {
    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
