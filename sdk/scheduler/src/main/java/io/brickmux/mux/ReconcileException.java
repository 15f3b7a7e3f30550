package io.brickmux.mux;

/**
 * Thrown when persisted brick state can't be read during startup reconciliation.
 */
public class ReconcileException extends Exception {

    public ReconcileException(String message, Throwable cause) {
        super(message, cause);
    }
}
