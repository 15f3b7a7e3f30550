package io.brickmux.process;

import io.brickmux.util.LoggingUtils;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ProcessWatcher} which combines {@link ProcessHandle#onExit()} notifications with polling at a fixed
 * interval. Polling covers processes which aren't children of this JVM, and detects PID reuse through the start time
 * recorded in the {@link ProcessFingerprint}.
 *
 * <p>Listeners are invoked on a pool of callback threads, one exit per task, so that a listener which blocks on one
 * process doesn't hold back the exits of others. Each exit is still delivered at most once.
 */
public class ProcessHandleWatcher implements ProcessWatcher {

    private static final Logger LOGGER = LoggingUtils.getLogger(ProcessHandleWatcher.class);

    private final ProcessInspector inspector;
    private final ExecutorService callbackExecutor;
    private final ScheduledExecutorService pollExecutor;

    /**
     * Active watches, keyed by PID.
     */
    private final ConcurrentMap<Long, Watch> watches = new ConcurrentHashMap<>();

    public ProcessHandleWatcher(ProcessInspector inspector, Duration pollInterval) {
        this.inspector = inspector;
        this.callbackExecutor = Executors.newCachedThreadPool(
                new ThreadFactoryBuilder().setNameFormat("liveness-callback-%d").setDaemon(true).build());
        this.pollExecutor = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("liveness-poll-%d").setDaemon(true).build());
        long intervalMs = Math.max(1, pollInterval.toMillis());
        this.pollExecutor.scheduleWithFixedDelay(this::poll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void watch(ProcessFingerprint fingerprint, ExitListener listener) {
        Watch watch = new Watch(fingerprint, listener);
        Watch previous = watches.put(fingerprint.getPid(), watch);
        if (previous != null) {
            LOGGER.warn("Replacing watch on pid {}: {} => {}", fingerprint.getPid(), previous.fingerprint, fingerprint);
        }

        Optional<ProcessHandle> handle = ProcessHandle.of(fingerprint.getPid());
        if (handle.isPresent() && inspector.isAlive(fingerprint)) {
            LOGGER.info("Watching process: {}", fingerprint);
            handle.get().onExit().thenRun(() -> fire(watch, "exit notification"));
        } else {
            fire(watch, "not running when watched");
        }
    }

    @Override
    public void unwatch(ProcessFingerprint fingerprint) {
        Watch watch = watches.get(fingerprint.getPid());
        if (watch != null && watch.fingerprint.equals(fingerprint) && watches.remove(fingerprint.getPid(), watch)) {
            LOGGER.info("Stopped watching process: {}", fingerprint);
        }
    }

    @Override
    public void unwatchAll() {
        LOGGER.info("Stopping {} process watches", watches.size());
        watches.clear();
    }

    @Override
    public void close() {
        unwatchAll();
        pollExecutor.shutdownNow();
        callbackExecutor.shutdown();
        try {
            if (!callbackExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warn("Timed out waiting for pending exit callbacks");
                callbackExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            callbackExecutor.shutdownNow();
        }
    }

    /**
     * Returns the number of processes currently being watched.
     */
    @VisibleForTesting
    int getWatchCount() {
        return watches.size();
    }

    @VisibleForTesting
    void poll() {
        List<Watch> snapshot = new ArrayList<>(watches.values());
        for (Watch watch : snapshot) {
            try {
                if (!inspector.isAlive(watch.fingerprint)) {
                    fire(watch, "poll");
                }
            } catch (RuntimeException e) {
                // keep the poll thread alive
                LOGGER.error(String.format("Failed to check liveness of %s", watch.fingerprint), e);
            }
        }
    }

    /**
     * Delivers the exit of the watched process to its listener, unless the watch was removed or already fired.
     */
    private void fire(Watch watch, String source) {
        if (!watches.remove(watch.fingerprint.getPid(), watch) || !watch.fired.compareAndSet(false, true)) {
            return;
        }
        LOGGER.info("Process exited ({}): {}", source, watch.fingerprint);
        try {
            callbackExecutor.execute(() -> {
                try {
                    watch.listener.onProcessExit(watch.fingerprint);
                } catch (RuntimeException e) {
                    LOGGER.error(String.format("Exit callback failed for %s", watch.fingerprint), e);
                }
            });
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Dropping exit of {}: watcher is closed", watch.fingerprint);
        }
    }

    private static final class Watch {
        private final ProcessFingerprint fingerprint;
        private final ExitListener listener;
        private final AtomicBoolean fired = new AtomicBoolean(false);

        private Watch(ProcessFingerprint fingerprint, ExitListener listener) {
            this.fingerprint = fingerprint;
            this.listener = listener;
        }
    }
}
