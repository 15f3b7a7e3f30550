package io.brickmux.mux;

import io.brickmux.brick.BrickId;
import io.brickmux.brick.BrickRuntime;
import io.brickmux.process.PortAllocator;
import io.brickmux.process.ProcessFingerprint;
import io.brickmux.process.ProcessWatcher;
import io.brickmux.state.BrickStore;
import io.brickmux.state.StateStoreException;
import io.brickmux.util.LoggingUtils;

import org.slf4j.Logger;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Marks bricks offline when the process serving them exits. Each process exit is handled at most once: its entry is
 * removed, every attached brick is recorded as {@link io.brickmux.brick.BrickState#OFFLINE}, and its port is
 * released.
 */
public class LivenessMonitor implements ProcessWatcher.ExitListener {

    private static final Logger LOGGER = LoggingUtils.getLogger(LivenessMonitor.class);

    private final ProcessRegistry registry;
    private final ProcessWatcher watcher;
    private final BrickStore brickStore;
    private final PortAllocator portAllocator;

    public LivenessMonitor(
            ProcessRegistry registry, ProcessWatcher watcher, BrickStore brickStore, PortAllocator portAllocator) {
        this.registry = registry;
        this.watcher = watcher;
        this.brickStore = brickStore;
        this.portAllocator = portAllocator;
    }

    public void watch(ProcessEntry entry) {
        watcher.watch(entry.getFingerprint(), this);
    }

    /**
     * Stops watching the entry's process, so that stopping it on purpose isn't treated as a crash.
     */
    public void unwatch(ProcessEntry entry) {
        watcher.unwatch(entry.getFingerprint());
    }

    public void unwatchAll() {
        watcher.unwatchAll();
    }

    @Override
    public void onProcessExit(ProcessFingerprint fingerprint) {
        Optional<ProcessEntry> entry = registry.lookupByPid(fingerprint.getPid());
        if (!entry.isPresent()) {
            LOGGER.info("Exited process isn't registered, nothing to do: {}", fingerprint);
            return;
        }
        if (!entry.get().getFingerprint().equals(fingerprint)) {
            LOGGER.info("PID {} now belongs to {}, ignoring exit of {}",
                    fingerprint.getPid(), entry.get(), fingerprint);
            return;
        }
        ReentrantLock lock = registry.getLock(entry.get().getKey());
        lock.lock();
        try {
            if (registry.contains(entry.get())) {
                purge(entry.get(), "process exited");
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes an entry whose process is gone, and marks all of its bricks offline. The caller must hold the lock of
     * the entry's key.
     */
    public void purge(ProcessEntry entry, String reason) {
        LOGGER.warn("Marking {} bricks offline ({}): {}", entry.getBrickCount(), reason, entry);
        watcher.unwatch(entry.getFingerprint());
        Set<BrickId> bricks = registry.remove(entry);
        for (BrickId brick : bricks) {
            registry.markOffline(brick);
            try {
                brickStore.storeRuntime(brick, BrickRuntime.offline());
            } catch (StateStoreException e) {
                LOGGER.error(String.format("Failed to record brick %s as offline", brick), e);
            }
        }
        portAllocator.release(entry.getPort());
    }

    /**
     * Stops all watches. Must be called before the registry is torn down.
     */
    public void shutdown() {
        LOGGER.info("Shutting down liveness monitoring");
        watcher.close();
    }
}
