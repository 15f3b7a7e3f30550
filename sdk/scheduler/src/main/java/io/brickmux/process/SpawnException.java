package io.brickmux.process;

import java.io.IOException;

/**
 * Thrown when a brick-server process couldn't be created, or exited before it finished starting up.
 */
public class SpawnException extends IOException {

    public SpawnException(String message) {
        super(message);
    }

    public SpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
