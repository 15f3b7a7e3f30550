package io.brickmux.process;

import java.io.IOException;

/**
 * Thrown when a running brick-server process refuses to serve an additional brick, for example because it is
 * shutting down.
 */
public class AttachRejectedException extends IOException {

    private final int statusCode;

    public AttachRejectedException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * Returns the status code returned by the process.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
