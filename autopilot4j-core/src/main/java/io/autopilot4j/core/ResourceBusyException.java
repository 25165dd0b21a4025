package io.autopilot4j.core;

/**
 * Raised when a session or its profile is held by someone else.
 */
public class ResourceBusyException extends RuntimeException {

    public ResourceBusyException(String message) {
        super(message);
    }
}
