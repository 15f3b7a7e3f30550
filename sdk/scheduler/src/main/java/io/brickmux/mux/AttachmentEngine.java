package io.brickmux.mux;

import io.brickmux.brick.Brick;
import io.brickmux.brick.BrickId;
import io.brickmux.brick.BrickRuntime;
import io.brickmux.brick.BrickRuntimeInfo;
import io.brickmux.process.AttachRejectedException;
import io.brickmux.process.BrickProcess;
import io.brickmux.process.BrickProcessLauncher;
import io.brickmux.process.BrickServiceClient;
import io.brickmux.process.PortAllocator;
import io.brickmux.process.ProcessInspector;
import io.brickmux.process.SpawnException;
import io.brickmux.state.BrickStore;
import io.brickmux.util.LoggingUtils;

import org.slf4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Places bricks into brick-server processes: a brick joins the attachment point of its {@link CompatibilityKey}
 * when one is running, and otherwise gets a newly spawned process. All decisions for a key are made under that key's
 * lock, so two concurrent starts for the same key never both spawn.
 *
 * <p>Forced starts repair groups broken by a crash: they never reuse a process which already existed when the brick
 * last went offline. The first forced brick of a broken group spawns a fresh process, and the other bricks of the key
 * then attach to it.
 */
public class AttachmentEngine {

    private static final Logger LOGGER = LoggingUtils.getLogger(AttachmentEngine.class);

    private final ProcessRegistry registry;
    private final CompatibilityClassifier classifier;
    private final LivenessMonitor livenessMonitor;
    private final BrickProcessLauncher launcher;
    private final BrickServiceClient serviceClient;
    private final ProcessInspector inspector;
    private final PortAllocator portAllocator;
    private final BrickStore brickStore;
    private final Duration stopGracePeriod;

    public AttachmentEngine(
            ProcessRegistry registry,
            CompatibilityClassifier classifier,
            LivenessMonitor livenessMonitor,
            BrickProcessLauncher launcher,
            BrickServiceClient serviceClient,
            ProcessInspector inspector,
            PortAllocator portAllocator,
            BrickStore brickStore,
            Duration stopGracePeriod) {
        this.registry = registry;
        this.classifier = classifier;
        this.livenessMonitor = livenessMonitor;
        this.launcher = launcher;
        this.serviceClient = serviceClient;
        this.inspector = inspector;
        this.portAllocator = portAllocator;
        this.brickStore = brickStore;
        this.stopGracePeriod = stopGracePeriod;
    }

    /**
     * Starts the brick, attaching it to a compatible running process or spawning a new one.
     *
     * @throws SpawnException if a new process was needed but couldn't be started, in which case no registry changes
     *                        were made for the brick
     */
    public BrickRuntimeInfo startBrick(Brick brick, boolean force) throws SpawnException {
        BrickId id = brick.getId();
        CompatibilityKey key = classifier.classify(brick);

        Optional<ProcessEntry> current = registry.lookupByBrick(id);
        if (current.isPresent() && !current.get().getKey().equals(key)) {
            // options changed since the brick was started: move it
            LOGGER.info("Brick {} moves from {} to {}", id, current.get().getKey(), key);
            stopBrick(brick);
        }

        ReentrantLock lock = registry.getLock(key);
        lock.lock();
        try {
            Optional<ProcessEntry> attached = registry.lookupByBrick(id);
            if (attached.isPresent() && attached.get().getKey().equals(key)) {
                if (inspector.isAlive(attached.get().getFingerprint())) {
                    LOGGER.info("Brick {} is already running in {}", id, attached.get());
                    return attached.get().getRuntimeInfo();
                }
                livenessMonitor.purge(attached.get(), "stale entry");
            }

            int maxBricks = getMaxBricksPerProcess(brick);
            long offlineEpoch = force ? registry.getOfflineEpoch(id) : 0;
            Optional<ProcessEntry> candidate;
            while ((candidate = registry.lookup(key, entry -> isCandidate(entry, id, maxBricks, force, offlineEpoch)))
                    .isPresent()) {
                ProcessEntry entry = candidate.get();
                if (!inspector.isAlive(entry.getFingerprint())) {
                    livenessMonitor.purge(entry, "stale entry");
                    continue;
                }
                if (attach(entry, id)) {
                    return entry.getRuntimeInfo();
                }
                // rejected: spawn instead
                break;
            }
            return spawn(brick, key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the brick. If it is the last brick of its process, the process is terminated once the key's lock has been
     * released. Stopping a brick which isn't running only resets its runtime record.
     */
    public void stopBrick(Brick brick) {
        BrickId id = brick.getId();
        CompatibilityKey key = registry.lookupByBrick(id)
                .map(ProcessEntry::getKey)
                .orElseGet(() -> classifier.classify(brick));
        Optional<ProcessEntry> toTerminate = Optional.empty();
        while (true) {
            ReentrantLock lock = registry.getLock(key);
            lock.lock();
            try {
                Optional<ProcessEntry> current = registry.lookupByBrick(id);
                if (current.isPresent() && !current.get().getKey().equals(key)) {
                    LOGGER.info("Brick {} moved concurrently to {}", id, current.get());
                    key = current.get().getKey();
                    continue;
                }
                if (current.isPresent()) {
                    toTerminate = stopLocked(current.get(), id);
                } else {
                    LOGGER.info("Brick {} isn't running", id);
                }
                registry.markOffline(id);
                brickStore.storeRuntime(id, BrickRuntime.notStarted());
                break;
            } finally {
                lock.unlock();
            }
        }
        if (toTerminate.isPresent()) {
            terminate(toTerminate.get());
        }
    }

    /**
     * Detaches the brick from its entry. When it was the last brick, the entry is removed and returned so that its
     * process can be terminated without holding the lock.
     */
    private Optional<ProcessEntry> stopLocked(ProcessEntry entry, BrickId id) {
        if (entry.getBrickCount() > 1) {
            try {
                serviceClient.detach(entry.getPort(), id);
            } catch (IOException e) {
                LOGGER.warn(String.format("Failed to detach brick %s from %s, dropping it anyway", id, entry), e);
            }
            registry.detachBrick(entry, id);
            LOGGER.info("Detached brick {} from {}", id, entry);
            return Optional.empty();
        }
        LOGGER.info("Brick {} is the last brick of {}, terminating process", id, entry);
        livenessMonitor.unwatch(entry);
        registry.remove(entry);
        return Optional.of(entry);
    }

    private void terminate(ProcessEntry entry) {
        if (!inspector.terminate(entry.getFingerprint(), stopGracePeriod)) {
            LOGGER.error("Process may still be running: {}", entry);
        }
        portAllocator.release(entry.getPort());
    }

    private static boolean isCandidate(
            ProcessEntry entry, BrickId id, int maxBricks, boolean force, long offlineEpoch) {
        if (maxBricks > 0 && entry.getBrickCount() >= maxBricks) {
            LOGGER.info("Skipping full {} for brick {} (limit {})", entry, id, maxBricks);
            return false;
        }
        if (force && entry.getEpoch() <= offlineEpoch) {
            LOGGER.info("Forced start of brick {} skips {}, which predates the brick going offline", id, entry);
            return false;
        }
        return true;
    }

    /**
     * Attaches the brick to a running entry over its control channel.
     *
     * @return whether the process accepted the brick
     */
    private boolean attach(ProcessEntry entry, BrickId id) {
        try {
            serviceClient.attach(entry.getPort(), id);
        } catch (AttachRejectedException e) {
            LOGGER.warn("Process {} rejected brick {}: {}", entry, id, e.getMessage());
            return false;
        } catch (IOException e) {
            LOGGER.warn(String.format("Failed to attach brick %s to %s", id, entry), e);
            return false;
        }
        registry.attachBrick(entry, id);
        brickStore.storeRuntime(id, BrickRuntime.online(entry.getFingerprint(), entry.getPort()));
        LOGGER.info("Attached brick {} to {}", id, entry);
        return true;
    }

    private BrickRuntimeInfo spawn(Brick brick, CompatibilityKey key) throws SpawnException {
        int port = portAllocator.allocate();
        final BrickProcess process;
        try {
            process = launcher.launch(brick, key.getDigest(), port);
        } catch (SpawnException e) {
            portAllocator.release(port);
            LOGGER.error(String.format("Failed to spawn process for brick %s", brick.getId()), e);
            throw e;
        }
        ProcessEntry entry = new ProcessEntry(process.getFingerprint(), process.getPort(), key, registry.newEpoch());
        registry.insert(entry);
        registry.attachBrick(entry, brick.getId());
        livenessMonitor.watch(entry);
        brickStore.storeRuntime(brick.getId(), BrickRuntime.online(entry.getFingerprint(), entry.getPort()));
        LOGGER.info("Spawned {} for brick {}", entry, brick.getId());
        return entry.getRuntimeInfo();
    }

    private static int getMaxBricksPerProcess(Brick brick) {
        String value = brick.getEffectiveOptions().get(MuxOptionsConfig.MAX_BRICKS_PER_PROCESS_OPTION);
        if (value == null) {
            return 0;
        }
        try {
            return Math.max(0, Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            LOGGER.warn("Ignoring invalid {} value: {}", MuxOptionsConfig.MAX_BRICKS_PER_PROCESS_OPTION, value);
            return 0;
        }
    }
}
