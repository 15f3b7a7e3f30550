package io.brickmux.brick;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * The process serving a started brick.
 */
public final class BrickRuntimeInfo {

    private final long pid;
    private final int port;

    public BrickRuntimeInfo(long pid, int port) {
        this.pid = pid;
        this.port = port;
    }

    public long getPid() {
        return pid;
    }

    public int getPort() {
        return port;
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
        return String.format("pid=%d port=%d", pid, port);
    }
}
