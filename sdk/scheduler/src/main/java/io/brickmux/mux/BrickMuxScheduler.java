package io.brickmux.mux;

import io.brickmux.brick.Brick;
import io.brickmux.brick.BrickId;
import io.brickmux.brick.BrickRuntimeInfo;
import io.brickmux.brick.BrickStatusInfo;
import io.brickmux.process.BrickProcessLauncher;
import io.brickmux.process.BrickServiceClient;
import io.brickmux.process.DefaultProcessInspector;
import io.brickmux.process.HttpBrickServiceClient;
import io.brickmux.process.PortAllocator;
import io.brickmux.process.ProcessHandleWatcher;
import io.brickmux.process.ProcessInspector;
import io.brickmux.process.ProcessWatcher;
import io.brickmux.process.SpawnException;
import io.brickmux.state.BrickStore;
import io.brickmux.state.ClusterOptionStore;
import io.brickmux.state.StateStoreException;
import io.brickmux.storage.Persister;
import io.brickmux.storage.StorageError.Reason;
import io.brickmux.util.LoggingUtils;

import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for starting, stopping and querying bricks. Wires the classifier, registry, attachment engine, liveness
 * monitor and reconciler together over a {@link Persister}.
 *
 * <p>{@link #reconcile()} must complete before any brick is started or stopped.
 */
public class BrickMuxScheduler {

    private static final Logger LOGGER = LoggingUtils.getLogger(BrickMuxScheduler.class);

    private final Persister persister;
    private final BrickStore brickStore;
    private final ClusterOptionStore clusterOptionStore;
    private final ProcessRegistry registry;
    private final AttachmentEngine engine;
    private final LivenessMonitor livenessMonitor;
    private final RecoveryReconciler reconciler;
    private final AtomicBoolean reconciled = new AtomicBoolean(false);

    /**
     * Builder for {@link BrickMuxScheduler}. The process layer defaults to real OS processes and the HTTP control
     * channel, and may be replaced piecewise.
     */
    public static final class Builder {
        private final Persister persister;
        private final BrickProcessLauncher launcher;
        private MuxOptionsConfig muxOptionsConfig;
        private ProcessInspector inspector = new DefaultProcessInspector();
        private Optional<ProcessWatcher> watcher = Optional.empty();
        private BrickServiceClient serviceClient = new HttpBrickServiceClient(Duration.ofSeconds(5));
        private Duration livenessPollInterval = Duration.ofSeconds(1);
        private Duration stopGracePeriod = Duration.ofSeconds(10);
        private int minPort = PortAllocator.DEFAULT_MIN_PORT;
        private int maxPort = PortAllocator.DEFAULT_MAX_PORT;
        private boolean exitOnDeadlock = true;

        private Builder(Persister persister, BrickProcessLauncher launcher) {
            this.persister = persister;
            this.launcher = launcher;
        }

        /**
         * Sets the mux-sensitive option rules. Defaults to the rules bundled in {@code brickmux-options.yml}.
         */
        public Builder setMuxOptionsConfig(MuxOptionsConfig muxOptionsConfig) {
            this.muxOptionsConfig = muxOptionsConfig;
            return this;
        }

        public Builder setProcessInspector(ProcessInspector inspector) {
            this.inspector = inspector;
            return this;
        }

        /**
         * Sets the watcher for process exits. Defaults to a {@link ProcessHandleWatcher} over the configured inspector.
         */
        public Builder setProcessWatcher(ProcessWatcher watcher) {
            this.watcher = Optional.of(watcher);
            return this;
        }

        public Builder setServiceClient(BrickServiceClient serviceClient) {
            this.serviceClient = serviceClient;
            return this;
        }

        public Builder setLivenessPollInterval(Duration livenessPollInterval) {
            this.livenessPollInterval = livenessPollInterval;
            return this;
        }

        public Builder setStopGracePeriod(Duration stopGracePeriod) {
            this.stopGracePeriod = stopGracePeriod;
            return this;
        }

        public Builder setPortRange(int minPort, int maxPort) {
            this.minPort = minPort;
            this.maxPort = maxPort;
            return this;
        }

        /**
         * Whether a detected deadlock between key locks should terminate the process. Tests disable this.
         */
        public Builder setExitOnDeadlock(boolean exitOnDeadlock) {
            this.exitOnDeadlock = exitOnDeadlock;
            return this;
        }

        /**
         * @throws IOException if the default mux option rules couldn't be loaded
         */
        public BrickMuxScheduler build() throws IOException {
            MuxOptionsConfig config = muxOptionsConfig == null ? MuxOptionsConfig.loadDefault() : muxOptionsConfig;
            ProcessWatcher processWatcher = watcher.isPresent()
                    ? watcher.get()
                    : new ProcessHandleWatcher(inspector, livenessPollInterval);
            return new BrickMuxScheduler(this, config, processWatcher);
        }
    }

    public static Builder newBuilder(Persister persister, BrickProcessLauncher launcher) {
        return new Builder(persister, launcher);
    }

    private BrickMuxScheduler(Builder builder, MuxOptionsConfig config, ProcessWatcher watcher) {
        this.persister = builder.persister;
        this.brickStore = new BrickStore(persister);
        this.clusterOptionStore = new ClusterOptionStore(persister);
        this.registry = new ProcessRegistry(new KeyLockTable(builder.exitOnDeadlock));
        PortAllocator portAllocator = new PortAllocator(builder.minPort, builder.maxPort);
        CompatibilityClassifier classifier = new CompatibilityClassifier(config);
        this.livenessMonitor = new LivenessMonitor(registry, watcher, brickStore, portAllocator);
        this.engine = new AttachmentEngine(
                registry,
                classifier,
                livenessMonitor,
                builder.launcher,
                builder.serviceClient,
                builder.inspector,
                portAllocator,
                brickStore,
                builder.stopGracePeriod);
        this.reconciler = new RecoveryReconciler(
                registry,
                classifier,
                livenessMonitor,
                builder.inspector,
                portAllocator,
                brickStore,
                clusterOptionStore);
    }

    /**
     * Rebuilds process placement from persisted state. Must be called once at startup, before bricks are started or
     * stopped. Calling it again rebuilds the same state.
     *
     * @throws ReconcileException if persisted state couldn't be read
     */
    public void reconcile() throws ReconcileException {
        reconciler.reconcile();
        reconciled.set(true);
    }

    public boolean isReconciled() {
        return reconciled.get();
    }

    // Bricks

    /**
     * Starts a brick with the provided effective options, attaching it to a compatible process when one is running.
     *
     * @param force whether to start a fresh process rather than reuse one which predates the brick going offline
     * @throws SpawnException if a new process was needed and couldn't be started
     * @throws IllegalStateException if {@link #reconcile()} hasn't completed
     */
    public BrickRuntimeInfo startBrick(BrickId brick, Map<String, String> effectiveOptions, boolean force)
            throws SpawnException {
        checkReconciled();
        return engine.startBrick(new Brick(brick, effectiveOptions), force);
    }

    /**
     * Stops a brick. The options of its volume identify the process it would be started in, when it isn't running.
     *
     * @throws IllegalStateException if {@link #reconcile()} hasn't completed
     */
    public void stopBrick(BrickId brick) throws StateStoreException {
        checkReconciled();
        Map<String, String> volumeOptions;
        try {
            volumeOptions = brickStore.fetchVolumeOptions(brick.getVolume());
        } catch (StateStoreException e) {
            if (e.getReason() != Reason.NOT_FOUND) {
                throw e;
            }
            volumeOptions = Collections.emptyMap();
        }
        engine.stopBrick(new Brick(brick, Brick.mergeOptions(clusterOptionStore.fetchOptions(), volumeOptions)));
    }

    public BrickStatusInfo brickStatus(BrickId brick) throws StateStoreException {
        return new BrickStatusInfo(brick, brickStore.fetchRuntime(brick));
    }

    /**
     * Returns the status of every brick defined for the volume.
     *
     * @throws StateStoreException with {@link io.brickmux.storage.StorageError.Reason#NOT_FOUND} if the volume
     *                             doesn't exist
     */
    public List<BrickStatusInfo> bricksStatus(String volume) throws StateStoreException {
        List<BrickStatusInfo> statuses = new ArrayList<>();
        for (BrickId brick : brickStore.fetchBrickIds(volume)) {
            statuses.add(brickStatus(brick));
        }
        return statuses;
    }

    // Volumes

    /**
     * Stores the definition of a volume: its options and its bricks. Running bricks are left as they are, and pick
     * up option changes when they are next started.
     */
    public void defineVolume(String volume, Map<String, String> options, Collection<BrickId> bricks)
            throws StateStoreException {
        brickStore.storeVolume(volume, options, bricks);
    }

    /**
     * Stops every brick of the volume, then removes its definition.
     */
    public VolumeOperationResult deleteVolume(String volume) throws StateStoreException {
        VolumeOperationResult result = stopVolume(volume);
        if (!result.isSuccess()) {
            LOGGER.warn("Not deleting volume {}: some bricks failed to stop: {}", volume, result);
            return result;
        }
        brickStore.deleteVolume(volume);
        LOGGER.info("Deleted volume {}", volume);
        return result;
    }

    /**
     * Starts every brick of the volume with the volume's effective options. A brick which fails to start doesn't
     * affect the others.
     */
    public VolumeOperationResult startVolume(String volume, boolean force) throws StateStoreException {
        checkReconciled();
        Map<String, String> effectiveOptions = getEffectiveOptions(volume);
        Map<BrickId, VolumeOperationResult.BrickResult> results = new LinkedHashMap<>();
        for (BrickId brick : brickStore.fetchBrickIds(volume)) {
            try {
                results.put(brick, VolumeOperationResult.BrickResult.started(
                        engine.startBrick(new Brick(brick, effectiveOptions), force)));
            } catch (SpawnException | RuntimeException e) {
                LOGGER.error(String.format("Failed to start brick %s", brick), e);
                results.put(brick, VolumeOperationResult.BrickResult.failed(e.getMessage()));
            }
        }
        VolumeOperationResult result = new VolumeOperationResult(volume, results);
        LOGGER.info("Started volume {} (force={}): {}", volume, force, result);
        return result;
    }

    public VolumeOperationResult stopVolume(String volume) throws StateStoreException {
        checkReconciled();
        Map<String, String> effectiveOptions = getEffectiveOptions(volume);
        Map<BrickId, VolumeOperationResult.BrickResult> results = new LinkedHashMap<>();
        for (BrickId brick : brickStore.fetchBrickIds(volume)) {
            try {
                engine.stopBrick(new Brick(brick, effectiveOptions));
                results.put(brick, VolumeOperationResult.BrickResult.stopped());
            } catch (RuntimeException e) {
                LOGGER.error(String.format("Failed to stop brick %s", brick), e);
                results.put(brick, VolumeOperationResult.BrickResult.failed(e.getMessage()));
            }
        }
        VolumeOperationResult result = new VolumeOperationResult(volume, results);
        LOGGER.info("Stopped volume {}: {}", volume, result);
        return result;
    }

    /**
     * Returns the cluster options overlaid with the options of the volume.
     */
    public Map<String, String> getEffectiveOptions(String volume) throws StateStoreException {
        return Brick.mergeOptions(clusterOptionStore.fetchOptions(), brickStore.fetchVolumeOptions(volume));
    }

    // Cluster options

    public Map<String, String> getClusterOptions() throws StateStoreException {
        return clusterOptionStore.fetchOptions();
    }

    /**
     * Stores cluster-wide options, such as {@code cluster.brick-multiplex}. Running bricks are unaffected until they
     * are next started.
     */
    public void setClusterOptions(Map<String, String> options) throws StateStoreException {
        clusterOptionStore.storeOptions(options);
        LOGGER.info("Updated cluster options: {}", options);
    }

    /**
     * Stops liveness monitoring and closes the persister. Brick processes keep running, and are recovered by
     * {@link #reconcile()} on the next start.
     */
    public void shutdown() {
        LOGGER.info("Shutting down scheduler");
        livenessMonitor.shutdown();
        persister.close();
    }

    @VisibleForTesting
    ProcessRegistry getRegistry() {
        return registry;
    }

    private void checkReconciled() {
        if (!reconciled.get()) {
            throw new IllegalStateException("Bricks can't be started or stopped before reconciliation has completed");
        }
    }
}
