package com.whereq.orbit.exception;

/**
 * Thrown when no candidate platform can currently satisfy a placement.
 * Expected steady state, re-attempted on the next reconciliation tick
 */
public class NoCapacityException extends RuntimeException {
    public NoCapacityException(String message) {
        super(message);
    }

    public NoCapacityException(String message, Throwable cause) {
        super(message, cause);
    }
}
