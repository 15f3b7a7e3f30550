package io.brickmux.process;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.time.Instant;
import java.util.Optional;

/**
 * Identifies one lifetime of an OS process: its PID together with its start time. A PID alone is not enough, since
 * the OS may reuse it for an unrelated process once the original exits.
 */
public final class ProcessFingerprint {

    /**
     * Start time value for when the OS did not report one.
     */
    public static final long UNKNOWN_START_TIME = 0;

    private final long pid;
    private final long startTimeMs;

    @JsonCreator
    public ProcessFingerprint(
            @JsonProperty("pid") long pid,
            @JsonProperty("start-time-ms") long startTimeMs) {
        this.pid = pid;
        this.startTimeMs = startTimeMs;
    }

    /**
     * Returns the fingerprint of the provided live process handle.
     */
    public static ProcessFingerprint of(ProcessHandle handle) {
        Optional<Instant> startInstant = handle.info().startInstant();
        return new ProcessFingerprint(
                handle.pid(),
                startInstant.isPresent() ? startInstant.get().toEpochMilli() : UNKNOWN_START_TIME);
    }

    @JsonProperty("pid")
    public long getPid() {
        return pid;
    }

    @JsonProperty("start-time-ms")
    public long getStartTimeMs() {
        return startTimeMs;
    }

    /**
     * Returns whether the two fingerprints may refer to the same process lifetime: PIDs are equal, and start times
     * are equal or at least one of them is unknown.
     */
    public boolean matches(ProcessFingerprint other) {
        if (other == null || pid != other.pid) {
            return false;
        }
        return startTimeMs == UNKNOWN_START_TIME
                || other.startTimeMs == UNKNOWN_START_TIME
                || startTimeMs == other.startTimeMs;
    }

    @Override
    public boolean equals(Object o) {
        return EqualsBuilder.reflectionEquals(this, o);
    }

    @Override
    public int hashCode() {
        return HashCodeBuilder.reflectionHashCode(this);
    }

    @Override
    public String toString() {
        return String.format("pid=%d start=%d", pid, startTimeMs);
    }
}
