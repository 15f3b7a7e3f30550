package io.brickmux.mux;

import io.brickmux.brick.Brick;
import io.brickmux.brick.BrickId;
import io.brickmux.brick.BrickRuntime;
import io.brickmux.brick.BrickState;
import io.brickmux.process.PortAllocator;
import io.brickmux.process.ProcessFingerprint;
import io.brickmux.process.ProcessInspector;
import io.brickmux.state.BrickStore;
import io.brickmux.state.ClusterOptionStore;
import io.brickmux.state.StateStoreException;
import io.brickmux.util.LoggingUtils;

import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rebuilds the {@link ProcessRegistry} after a control plane restart, from the persisted runtime records of bricks
 * and the processes which are still running. Bricks whose process is gone are marked offline. No process is ever
 * spawned here: offline bricks stay offline until they are started again.
 */
public class RecoveryReconciler {

    private static final Logger LOGGER = LoggingUtils.getLogger(RecoveryReconciler.class);

    private final ProcessRegistry registry;
    private final CompatibilityClassifier classifier;
    private final LivenessMonitor livenessMonitor;
    private final ProcessInspector inspector;
    private final PortAllocator portAllocator;
    private final BrickStore brickStore;
    private final ClusterOptionStore clusterOptionStore;

    public RecoveryReconciler(
            ProcessRegistry registry,
            CompatibilityClassifier classifier,
            LivenessMonitor livenessMonitor,
            ProcessInspector inspector,
            PortAllocator portAllocator,
            BrickStore brickStore,
            ClusterOptionStore clusterOptionStore) {
        this.registry = registry;
        this.classifier = classifier;
        this.livenessMonitor = livenessMonitor;
        this.inspector = inspector;
        this.portAllocator = portAllocator;
        this.brickStore = brickStore;
        this.clusterOptionStore = clusterOptionStore;
    }

    /**
     * Replaces the content of the registry with the processes found in persisted state. Running this again against
     * the same state yields the same registry.
     *
     * @throws ReconcileException if persisted state couldn't be read
     */
    public synchronized void reconcile() throws ReconcileException {
        LOGGER.info("Reconciling brick processes from persisted state...");
        livenessMonitor.unwatchAll();
        registry.clear();
        portAllocator.releaseAll();

        final Map<BrickId, BrickRuntime> runtimes;
        final Map<String, String> clusterOptions;
        try {
            runtimes = brickStore.fetchAllRuntimes();
            clusterOptions = clusterOptionStore.fetchOptions();
        } catch (StateStoreException e) {
            throw new ReconcileException("Failed to read persisted brick state", e);
        }

        // Group the online bricks by the process which served them.
        Map<ProcessFingerprint, List<BrickId>> bricksByProcess = new LinkedHashMap<>();
        Map<ProcessFingerprint, Integer> portsByProcess = new HashMap<>();
        int onlineCount = 0;
        for (Map.Entry<BrickId, BrickRuntime> entry : runtimes.entrySet()) {
            BrickRuntime runtime = entry.getValue();
            if (runtime.getState() != BrickState.ONLINE) {
                continue;
            }
            ++onlineCount;
            if (!runtime.getFingerprint().isPresent()) {
                LOGGER.warn("Brick {} is recorded online without a process", entry.getKey());
                recordOffline(entry.getKey());
                continue;
            }
            ProcessFingerprint fingerprint = runtime.getFingerprint().get();
            bricksByProcess.computeIfAbsent(fingerprint, fp -> new ArrayList<>()).add(entry.getKey());
            Integer previousPort = portsByProcess.putIfAbsent(fingerprint, runtime.getPort());
            if (previousPort != null && previousPort != runtime.getPort()) {
                LOGGER.warn("Brick {} records port {} but process {} was recorded with port {}",
                        entry.getKey(), runtime.getPort(), fingerprint, previousPort);
            }
        }
        LOGGER.info("Found {} bricks ({} recorded online) in {} processes",
                runtimes.size(), onlineCount, bricksByProcess.size());

        Map<String, Map<String, String>> optionsByVolume = new HashMap<>();
        int recoveredProcesses = 0;
        int recoveredBricks = 0;
        int offlineBricks = 0;
        for (Map.Entry<ProcessFingerprint, List<BrickId>> group : bricksByProcess.entrySet()) {
            ProcessFingerprint fingerprint = group.getKey();
            List<BrickId> bricks = group.getValue();
            if (!inspector.isAlive(fingerprint)) {
                LOGGER.info("Process {} is gone, marking {} bricks offline: {}", fingerprint, bricks.size(), bricks);
                for (BrickId brick : bricks) {
                    recordOffline(brick);
                }
                offlineBricks += bricks.size();
                continue;
            }

            int recovered = recoverProcess(
                    fingerprint, portsByProcess.get(fingerprint), bricks, clusterOptions, optionsByVolume);
            if (recovered > 0) {
                ++recoveredProcesses;
            }
            recoveredBricks += recovered;
            offlineBricks += bricks.size() - recovered;
        }

        LOGGER.info("Reconciliation complete: {} processes with {} bricks recovered, {} bricks offline",
                recoveredProcesses, recoveredBricks, offlineBricks);
    }

    /**
     * Registers a live process and attaches its bricks.
     *
     * @return the number of bricks attached
     */
    private int recoverProcess(
            ProcessFingerprint fingerprint,
            int port,
            List<BrickId> bricks,
            Map<String, String> clusterOptions,
            Map<String, Map<String, String>> optionsByVolume) {
        // The key comes from the first brick. Bricks which no longer classify the same way stay where they are.
        CompatibilityKey key = null;
        List<BrickId> remaining = new ArrayList<>(bricks);
        while (key == null && !remaining.isEmpty()) {
            BrickId first = remaining.get(0);
            try {
                key = classify(first, clusterOptions, optionsByVolume);
            } catch (StateStoreException e) {
                LOGGER.error(String.format("Failed to classify brick %s, marking it offline", first), e);
                recordOffline(first);
                remaining.remove(0);
            }
        }
        if (key == null) {
            return 0;
        }

        ProcessEntry entry = new ProcessEntry(fingerprint, port, key, registry.newEpoch());
        int attached = 0;
        ReentrantLock lock = registry.getLock(key);
        lock.lock();
        try {
            Optional<ProcessEntry> previous = registry.lookup(key);
            if (previous.isPresent()) {
                LOGGER.info("{} was started after {}, and becomes the attachment point of {}",
                        entry, previous.get(), key);
            }
            registry.insert(entry);
            for (BrickId brick : remaining) {
                try {
                    CompatibilityKey brickKey = classify(brick, clusterOptions, optionsByVolume);
                    if (!brickKey.equals(key)) {
                        LOGGER.warn("Brick {} now classifies as {} but runs in {}", brick, brickKey, entry);
                    }
                    registry.attachBrick(entry, brick);
                    ++attached;
                } catch (RuntimeException e) {
                    LOGGER.error(String.format("Failed to recover brick %s, marking it offline", brick), e);
                    recordOffline(brick);
                }
            }
            if (attached == 0) {
                registry.remove(entry);
                return 0;
            }
        } finally {
            lock.unlock();
        }
        portAllocator.reserve(port);
        livenessMonitor.watch(entry);
        LOGGER.info("Recovered {} with {} bricks", entry, attached);
        return attached;
    }

    private CompatibilityKey classify(
            BrickId brick,
            Map<String, String> clusterOptions,
            Map<String, Map<String, String>> optionsByVolume) throws StateStoreException {
        Map<String, String> volumeOptions = optionsByVolume.get(brick.getVolume());
        if (volumeOptions == null) {
            volumeOptions = brickStore.fetchVolumeOptions(brick.getVolume());
            optionsByVolume.put(brick.getVolume(), volumeOptions);
        }
        return classifier.classify(new Brick(brick, Brick.mergeOptions(clusterOptions, volumeOptions)));
    }

    /**
     * Stores an offline record without stamping an offline epoch, so that forced starts may attach to any process
     * recovered here.
     */
    private void recordOffline(BrickId brick) {
        try {
            brickStore.storeRuntime(brick, BrickRuntime.offline());
        } catch (StateStoreException e) {
            LOGGER.error(String.format("Failed to record brick %s as offline", brick), e);
        }
    }
}
