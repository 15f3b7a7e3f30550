package io.brickmux.process;

import java.time.Duration;

/**
 * Queries and signals OS processes by {@link ProcessFingerprint}.
 */
public interface ProcessInspector {

    /**
     * Returns whether the process identified by the fingerprint is still running. A different process which has
     * since been given the same PID is not considered alive.
     */
    boolean isAlive(ProcessFingerprint fingerprint);

    /**
     * Asks the process to exit (SIGTERM), waits up to {@code gracePeriod}, then kills it (SIGKILL) if it is still
     * running.
     *
     * @return whether the process is gone
     */
    boolean terminate(ProcessFingerprint fingerprint, Duration gracePeriod);
}
