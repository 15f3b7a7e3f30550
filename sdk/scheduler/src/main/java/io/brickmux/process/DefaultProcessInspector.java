package io.brickmux.process;

import io.brickmux.util.LoggingUtils;

import org.slf4j.Logger;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link ProcessInspector} backed by {@link ProcessHandle}.
 */
public class DefaultProcessInspector implements ProcessInspector {

    private static final Logger LOGGER = LoggingUtils.getLogger(DefaultProcessInspector.class);

    /**
     * How long to wait for the process to go away after SIGKILL.
     */
    private static final Duration KILL_WAIT = Duration.ofSeconds(5);

    @Override
    public boolean isAlive(ProcessFingerprint fingerprint) {
        return getHandle(fingerprint).isPresent();
    }

    @Override
    public boolean terminate(ProcessFingerprint fingerprint, Duration gracePeriod) {
        Optional<ProcessHandle> handle = getHandle(fingerprint);
        if (!handle.isPresent()) {
            LOGGER.info("Process already exited: {}", fingerprint);
            return true;
        }
        if (!gracePeriod.isZero()) {
            LOGGER.info("Sending SIGTERM to process: {}, waiting {}ms", fingerprint, gracePeriod.toMillis());
            handle.get().destroy();
            if (waitForExit(handle.get(), gracePeriod)) {
                LOGGER.info("Process has exited following SIGTERM: {}", fingerprint);
                return true;
            }
            LOGGER.warn("Process did not exit in {}ms following SIGTERM: {}", gracePeriod.toMillis(), fingerprint);
        }
        LOGGER.info("Sending SIGKILL to process: {}", fingerprint);
        handle.get().destroyForcibly();
        if (waitForExit(handle.get(), KILL_WAIT)) {
            return true;
        }
        LOGGER.error("Process did not exit in {}ms following SIGKILL: {}", KILL_WAIT.toMillis(), fingerprint);
        return false;
    }

    private static boolean waitForExit(ProcessHandle handle, Duration timeout) {
        try {
            handle.onExit().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !handle.isAlive();
        } catch (ExecutionException e) {
            LOGGER.warn(String.format("Failed to wait for exit of process %d", handle.pid()), e);
            return !handle.isAlive();
        } catch (TimeoutException e) {
            return false;
        }
    }

    /**
     * Returns a handle to the live process matching the fingerprint, if any.
     */
    private static Optional<ProcessHandle> getHandle(ProcessFingerprint fingerprint) {
        return ProcessHandle.of(fingerprint.getPid())
                .filter(ProcessHandle::isAlive)
                .filter(handle -> fingerprint.matches(ProcessFingerprint.of(handle)));
    }
}
