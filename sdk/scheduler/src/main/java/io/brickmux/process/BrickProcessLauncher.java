package io.brickmux.process;

import io.brickmux.brick.Brick;

/**
 * Starts brick-server processes.
 */
public interface BrickProcessLauncher {

    /**
     * Starts a process serving the provided brick on the provided port, and returns once the process has survived
     * its startup period.
     *
     * @param brick the first brick served by the process
     * @param keyDigest digest of the compatibility key which the process serves
     * @param port the port the process should listen on
     * @throws SpawnException if the process couldn't be started or exited during startup
     */
    BrickProcess launch(Brick brick, String keyDigest, int port) throws SpawnException;
}
