package io.brickmux.framework;

import io.brickmux.util.LoggingUtils;

import com.google.common.annotations.VisibleForTesting;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.component.AbstractLifeCycle;
import org.eclipse.jetty.util.component.LifeCycle;
import org.glassfish.jersey.jetty.JettyHttpContainerFactory;
import org.glassfish.jersey.server.ResourceConfig;
import org.slf4j.Logger;

import javax.ws.rs.core.UriBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.Collection;
import java.util.HashSet;
import java.util.Timer;
import java.util.TimerTask;

/**
 * The {@link ApiServer} runs the Jetty {@link Server} that exposes the scheduler's API.
 */
public class ApiServer {

    private static final Logger LOGGER = LoggingUtils.getLogger(ApiServer.class);

    private final int port;

    private final Server server;

    private final Duration startTimeout;

    private Thread serverThread;

    @VisibleForTesting
    ApiServer(int port, Duration startTimeout, Collection<Object> resources) {
        this.port = port;
        this.server = JettyHttpContainerFactory.createServer(
                UriBuilder.fromUri("http://0.0.0.0/").port(port).build(),
                new ResourceConfig().registerInstances(new HashSet<>(resources)),
                false /* don't start yet. wait for start() call below. */);
        this.startTimeout = startTimeout;
    }

    public static ApiServer start(BrickMuxConfig config, Collection<Object> resources, Runnable startedCallback) {
        ApiServer apiServer = new ApiServer(config.getApiServerPort(), config.getApiServerInitTimeout(), resources);
        apiServer.start(new AbstractLifeCycle.AbstractLifeCycleListener() {
            @Override
            public void lifeCycleStarted(LifeCycle event) {
                startedCallback.run();
            }
        });
        return apiServer;
    }

    /**
     * Launches the API server on a separate thread.
     *
     * @param listener A listener object which will be notified when the underlying server changes state
     */
    @VisibleForTesting
    void start(LifeCycle.Listener listener) {
        if (server.isStarted()) {
            throw new IllegalStateException("Already started");
        }
        server.addLifeCycleListener(listener);

        final Timer startTimer = new Timer("API-start-timeout");
        startTimer.schedule(new TimerTask() {
            @Override
            public void run() {
                if (!server.isStarted()) {
                    LOGGER.error("API Server failed to start at port {} within {}ms", port, startTimeout.toMillis());
                    ProcessExit.exit(ProcessExit.API_SERVER_ERROR);
                }
            }
        }, startTimeout.toMillis());

        Runnable runServerCallback = () -> {
            try {
                LOGGER.info("Starting API server at port {}", port);
                server.start();
                int localPort = ((ServerConnector) server.getConnectors()[0]).getLocalPort();
                LOGGER.info("API server started at port {}", localPort);
                startTimer.cancel();
                server.join();
            } catch (Exception e) { // SUPPRESS CHECKSTYLE IllegalCatch
                LOGGER.error(String.format("API server at port %d failed with exception: ", port), e);
                ProcessExit.exit(ProcessExit.API_SERVER_ERROR, e);
            } finally {
                LOGGER.info("API server at port {} exiting", port);
                try {
                    server.destroy();
                } catch (Exception e) { // SUPPRESS CHECKSTYLE IllegalCatch
                    LOGGER.error(String.format("Failed to stop API server at port %d with exception: ", port), e);
                }
            }
        };

        serverThread = new Thread(runServerCallback, "api-server");
        serverThread.start();
    }

    /**
     * Returns the server endpoint. Mainly used for testing.
     *
     * @throws IllegalStateException if the server is not running
     */
    @VisibleForTesting
    URI getURI() {
        if (!server.isRunning()) {
            throw new IllegalStateException("Server is not running");
        }
        return server.getURI();
    }

    /**
     * Waits for the server to stop. If the server is not stopped, this waits forever.
     */
    public void join() {
        while (true) {
            try {
                serverThread.join();
                break;
            } catch (InterruptedException e) {
                LOGGER.error("Interrupted while waiting for HTTP server to join. Retrying wait.", e);
            }
        }
    }

    /**
     * Stops the server.
     */
    public void stop() throws Exception {
        server.stop();
    }
}
