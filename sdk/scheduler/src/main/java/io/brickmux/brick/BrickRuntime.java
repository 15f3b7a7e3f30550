package io.brickmux.brick;

import io.brickmux.process.ProcessFingerprint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.time.Instant;
import java.util.Optional;

/**
 * The persisted runtime record of a brick: its state, and for online bricks the process serving it.
 */
public final class BrickRuntime {

    private final BrickState state;
    private final long pid;
    private final long startTimeMs;
    private final int port;
    private final Instant updated;

    @JsonCreator
    BrickRuntime(
            @JsonProperty("state") BrickState state,
            @JsonProperty("pid") long pid,
            @JsonProperty("start-time-ms") long startTimeMs,
            @JsonProperty("port") int port,
            @JsonProperty("updated") Instant updated) {
        this.state = state;
        this.pid = pid;
        this.startTimeMs = startTimeMs;
        this.port = port;
        this.updated = updated;
    }

    public static BrickRuntime online(ProcessFingerprint fingerprint, int port) {
        return new BrickRuntime(
                BrickState.ONLINE, fingerprint.getPid(), fingerprint.getStartTimeMs(), port, Instant.now());
    }

    public static BrickRuntime offline() {
        return new BrickRuntime(BrickState.OFFLINE, 0, ProcessFingerprint.UNKNOWN_START_TIME, 0, Instant.now());
    }

    public static BrickRuntime notStarted() {
        return new BrickRuntime(BrickState.NOT_STARTED, 0, ProcessFingerprint.UNKNOWN_START_TIME, 0, Instant.now());
    }

    @JsonProperty("state")
    public BrickState getState() {
        return state;
    }

    @JsonProperty("pid")
    public long getPid() {
        return pid;
    }

    @JsonProperty("start-time-ms")
    public long getStartTimeMs() {
        return startTimeMs;
    }

    @JsonProperty("port")
    public int getPort() {
        return port;
    }

    @JsonProperty("updated")
    public Instant getUpdated() {
        return updated;
    }

    /**
     * Returns the fingerprint of the serving process, or an empty value if the brick isn't online.
     */
    @JsonIgnore
    public Optional<ProcessFingerprint> getFingerprint() {
        return state == BrickState.ONLINE
                ? Optional.of(new ProcessFingerprint(pid, startTimeMs))
                : Optional.empty();
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
        return String.format("%s pid=%d port=%d", state, pid, port);
    }
}
