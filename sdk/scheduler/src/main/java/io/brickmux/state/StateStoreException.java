package io.brickmux.state;

import io.brickmux.storage.PersisterException;
import io.brickmux.storage.StorageError.Reason;

/**
 * Exception that indicates that there was an issue with storing or accessing values in a state store.
 * The underlying exception from the storage implementation, if any, is nested inside this exception.
 */
public class StateStoreException extends RuntimeException {

    private final Reason reason;

    public StateStoreException(PersisterException e) {
        super(e);
        this.reason = e.getReason();
    }

    public StateStoreException(PersisterException e, String message) {
        super(message, e);
        this.reason = e.getReason();
    }

    public StateStoreException(Reason reason, Throwable e) {
        super(e);
        this.reason = reason;
    }

    public StateStoreException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public StateStoreException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /**
     * Returns the machine-parseable reason for this exception. Used for logging and for delineating different error
     * cases in REST APIs.
     */
    public Reason getReason() {
        return reason;
    }

    @Override
    public String getMessage() {
        return String.format("%s (reason: %s)", super.getMessage(), reason);
    }
}
