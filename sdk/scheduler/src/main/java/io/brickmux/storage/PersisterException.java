package io.brickmux.storage;

import io.brickmux.storage.StorageError.Reason;

import java.io.IOException;

/**
 * Failure of a {@link Persister} operation, tagged with a {@link Reason} so that the stores above can tell a missing
 * record apart from a broken backend.
 */
public class PersisterException extends IOException {

    private final Reason reason;

    public PersisterException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public PersisterException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public static PersisterException notFound(String path) {
        return new PersisterException(Reason.NOT_FOUND, "No node at " + path);
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String getMessage() {
        return reason + ": " + super.getMessage();
    }
}
