package io.brickmux.process;

import io.brickmux.brick.BrickId;

import java.io.IOException;

/**
 * Control channel to a running brick-server process, used to add bricks to it and remove bricks from it.
 */
public interface BrickServiceClient {

    /**
     * Asks the process listening on the provided port to start serving an additional brick.
     *
     * @throws AttachRejectedException if the process refused the brick
     * @throws IOException if the process couldn't be reached
     */
    void attach(int port, BrickId brick) throws IOException;

    /**
     * Asks the process listening on the provided port to stop serving a brick.
     *
     * @throws IOException if the process couldn't be reached or refused the request
     */
    void detach(int port, BrickId brick) throws IOException;
}
