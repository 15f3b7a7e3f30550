package io.brickmux.framework;

import io.brickmux.process.PortAllocator;

import java.io.File;
import java.time.Duration;
import java.util.Optional;

/**
 * This class encapsulates global scheduler settings retrieved from the environment. Presented as a non-static object
 * to simplify tests.
 */
public final class BrickMuxConfig {

    /**
     * Name of the cluster, used to namespace persisted state in ZooKeeper.
     */
    private static final String CLUSTER_NAME_ENV = "CLUSTER_NAME";

    private static final String DEFAULT_CLUSTER_NAME = "brickmux";

    /**
     * ZooKeeper connection string, e.g. {@code zk-1:2181,zk-2:2181}. When unset, state is only kept in memory and is
     * lost on restart.
     */
    private static final String ZK_CONNECTION_ENV = "ZK_CONNECTION";

    /**
     * Port for the scheduler API.
     */
    private static final String API_PORT_ENV = "API_PORT";

    private static final int DEFAULT_API_PORT = 24007;

    /**
     * Envvar to specify a custom amount of time to wait for the API to come up during startup.
     */
    private static final String API_SERVER_TIMEOUT_S_ENV = "API_SERVER_TIMEOUT_S";

    private static final int DEFAULT_API_SERVER_TIMEOUT_S = 60;

    /**
     * Mustache template of the command which runs a brick server. See
     * {@link io.brickmux.process.CommandBrickProcessLauncher} for the available values.
     */
    private static final String BRICKD_COMMAND_ENV = "BRICKD_COMMAND";

    private static final String DEFAULT_BRICKD_COMMAND =
            "exec glusterfsd -s {{peer}} --volfile-id {{volume}}.{{peer}}.{{brick-name}} "
            + "--brick-name {{brick-path}} --brick-port {{port}} -N";

    /**
     * Range of ports handed out to brick servers.
     */
    private static final String BRICK_PORT_MIN_ENV = "BRICK_PORT_MIN";

    private static final String BRICK_PORT_MAX_ENV = "BRICK_PORT_MAX";

    /**
     * Upper bound on the time between a brick server exiting and its bricks being marked offline.
     */
    private static final String LIVENESS_POLL_INTERVAL_MS_ENV = "LIVENESS_POLL_INTERVAL_MS";

    private static final long DEFAULT_LIVENESS_POLL_INTERVAL_MS = 1000;

    /**
     * Time between SIGTERM and SIGKILL when stopping a brick server.
     */
    private static final String PROCESS_STOP_GRACE_MS_ENV = "PROCESS_STOP_GRACE_MS";

    private static final long DEFAULT_PROCESS_STOP_GRACE_MS = 10000;

    /**
     * Time a new brick server must stay up for its start to count as successful.
     */
    private static final String PROCESS_STARTUP_GRACE_MS_ENV = "PROCESS_STARTUP_GRACE_MS";

    private static final long DEFAULT_PROCESS_STARTUP_GRACE_MS = 500;

    /**
     * Timeout for attach/detach requests to running brick servers.
     */
    private static final String ATTACH_TIMEOUT_MS_ENV = "ATTACH_TIMEOUT_MS";

    private static final long DEFAULT_ATTACH_TIMEOUT_MS = 5000;

    /**
     * YAML file listing the mux-sensitive options. When unset, the bundled list is used.
     */
    private static final String MUX_OPTIONS_FILE_ENV = "MUX_OPTIONS_FILE";

    /**
     * Directory for brick server output. When unset, output goes to the scheduler's own stdout/stderr.
     */
    private static final String BRICK_LOG_DIR_ENV = "BRICK_LOG_DIR";

    /**
     * Controls whether deadlocks should lead to the scheduler process exiting (enabled by default).
     * If this envvar is set (to anything at all), the scheduler will not exit if a deadlock is encountered.
     */
    private static final String DISABLE_DEADLOCK_EXIT_ENV = "DISABLE_DEADLOCK_EXIT";

    private final EnvStore envStore;

    private BrickMuxConfig(EnvStore envStore) {
        this.envStore = envStore;
    }

    public static BrickMuxConfig fromEnv() {
        return fromEnvStore(EnvStore.fromEnv());
    }

    public static BrickMuxConfig fromEnvStore(EnvStore envStore) {
        return new BrickMuxConfig(envStore);
    }

    public String getClusterName() {
        return envStore.getOptionalNonEmpty(CLUSTER_NAME_ENV, DEFAULT_CLUSTER_NAME);
    }

    public Optional<String> getZkConnection() {
        return Optional.ofNullable(envStore.getOptionalNonEmpty(ZK_CONNECTION_ENV, null));
    }

    public int getApiServerPort() {
        return envStore.getOptionalInt(API_PORT_ENV, DEFAULT_API_PORT);
    }

    public Duration getApiServerInitTimeout() {
        return Duration.ofSeconds(envStore.getOptionalInt(API_SERVER_TIMEOUT_S_ENV, DEFAULT_API_SERVER_TIMEOUT_S));
    }

    public String getBrickCommandTemplate() {
        return envStore.getOptionalNonEmpty(BRICKD_COMMAND_ENV, DEFAULT_BRICKD_COMMAND);
    }

    public int getBrickPortMin() {
        return envStore.getOptionalInt(BRICK_PORT_MIN_ENV, PortAllocator.DEFAULT_MIN_PORT);
    }

    public int getBrickPortMax() {
        return envStore.getOptionalInt(BRICK_PORT_MAX_ENV, PortAllocator.DEFAULT_MAX_PORT);
    }

    public Duration getLivenessPollInterval() {
        return envStore.getOptionalPositiveMillis(LIVENESS_POLL_INTERVAL_MS_ENV, DEFAULT_LIVENESS_POLL_INTERVAL_MS);
    }

    public Duration getProcessStopGracePeriod() {
        return envStore.getOptionalPositiveMillis(PROCESS_STOP_GRACE_MS_ENV, DEFAULT_PROCESS_STOP_GRACE_MS);
    }

    public Duration getProcessStartupGracePeriod() {
        return envStore.getOptionalPositiveMillis(PROCESS_STARTUP_GRACE_MS_ENV, DEFAULT_PROCESS_STARTUP_GRACE_MS);
    }

    public Duration getAttachTimeout() {
        return envStore.getOptionalPositiveMillis(ATTACH_TIMEOUT_MS_ENV, DEFAULT_ATTACH_TIMEOUT_MS);
    }

    public Optional<File> getMuxOptionsFile() {
        return envStore.getOptionalFile(MUX_OPTIONS_FILE_ENV);
    }

    public Optional<File> getBrickLogDir() {
        return envStore.getOptionalFile(BRICK_LOG_DIR_ENV);
    }

    public boolean isDeadlockExitEnabled() {
        return !envStore.isPresent(DISABLE_DEADLOCK_EXIT_ENV);
    }
}
