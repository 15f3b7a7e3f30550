package io.brickmux.brick;

/**
 * Runtime status of a brick.
 */
public enum BrickState {

    /**
     * The brick has never been started, or was stopped on purpose.
     */
    NOT_STARTED,

    /**
     * The brick is served by a running brick-server process.
     */
    ONLINE,

    /**
     * The brick's process went away without the brick being stopped.
     */
    OFFLINE
}
