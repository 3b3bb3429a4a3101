package com.whereq.orbit.exception;

/**
 * Thrown when the chosen platform accepted a placement but failed to provision it.
 * The scheduler does not fail over to the next candidate
 */
public class ProvisioningException extends BackendException {
    public ProvisioningException(String message) {
        super(message);
    }

    public ProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
