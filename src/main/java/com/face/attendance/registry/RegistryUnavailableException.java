package com.face.attendance.registry;

/**
 * The signature registry could not answer: backend down, timed out, or rejected the call.
 * Callers may retry.
 */
public class RegistryUnavailableException extends RuntimeException {

    public RegistryUnavailableException(String message) {
        super(message);
    }

    public RegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
