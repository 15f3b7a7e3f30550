package io.brickmux.process;

import io.brickmux.util.LoggingUtils;

import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.HashSet;
import java.util.Set;

/**
 * Hands out listening ports for brick-server processes from a fixed range. A port is handed out only if it isn't
 * already held by another process of ours, and nothing else is currently bound to it.
 */
public class PortAllocator {

    private static final Logger LOGGER = LoggingUtils.getLogger(PortAllocator.class);

    public static final int DEFAULT_MIN_PORT = 49152;
    public static final int DEFAULT_MAX_PORT = 60999;

    private final int minPort;
    private final int maxPort;
    private final Set<Integer> allocated = new HashSet<>();
    private int nextPort;

    public PortAllocator(int minPort, int maxPort) {
        if (minPort <= 0 || maxPort > 65535 || minPort > maxPort) {
            throw new IllegalArgumentException(String.format("Invalid port range: %d-%d", minPort, maxPort));
        }
        this.minPort = minPort;
        this.maxPort = maxPort;
        this.nextPort = minPort;
    }

    /**
     * Returns a free port, which stays allocated until {@link #release(int)} is called.
     *
     * @throws SpawnException if every port in the range is taken
     */
    public synchronized int allocate() throws SpawnException {
        int rangeSize = maxPort - minPort + 1;
        for (int i = 0; i < rangeSize; ++i) {
            int port = nextPort;
            nextPort = (nextPort == maxPort) ? minPort : nextPort + 1;
            if (allocated.contains(port) || !isBindable(port)) {
                continue;
            }
            allocated.add(port);
            LOGGER.debug("Allocated port {}", port);
            return port;
        }
        throw new SpawnException(String.format("No free port in range %d-%d", minPort, maxPort));
    }

    /**
     * Marks a port as held, for processes which were found running rather than spawned.
     */
    public synchronized void reserve(int port) {
        allocated.add(port);
    }

    public synchronized void release(int port) {
        if (allocated.remove(port)) {
            LOGGER.debug("Released port {}", port);
        }
    }

    public synchronized void releaseAll() {
        allocated.clear();
    }

    @VisibleForTesting
    synchronized boolean isAllocated(int port) {
        return allocated.contains(port);
    }

    @VisibleForTesting
    boolean isBindable(int port) {
        try (ServerSocket socket = new ServerSocket()) {
            socket.setReuseAddress(false);
            socket.bind(new InetSocketAddress(port));
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
