package io.brickmux.mux;

import io.brickmux.brick.BrickId;
import io.brickmux.brick.BrickRuntimeInfo;
import io.brickmux.process.ProcessFingerprint;

import com.google.common.collect.ImmutableSortedSet;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One running brick-server process and the bricks attached to it. The brick set is only changed through
 * {@link ProcessRegistry}, under the lock of the entry's key.
 */
public final class ProcessEntry {

    private final ProcessFingerprint fingerprint;
    private final int port;
    private final CompatibilityKey key;
    private final long epoch;
    private final Set<BrickId> bricks = ConcurrentHashMap.newKeySet();

    public ProcessEntry(ProcessFingerprint fingerprint, int port, CompatibilityKey key, long epoch) {
        this.fingerprint = fingerprint;
        this.port = port;
        this.key = key;
        this.epoch = epoch;
    }

    public ProcessFingerprint getFingerprint() {
        return fingerprint;
    }

    public long getPid() {
        return fingerprint.getPid();
    }

    public int getPort() {
        return port;
    }

    public CompatibilityKey getKey() {
        return key;
    }

    /**
     * Returns the creation order of this entry: entries created later have larger epochs.
     */
    public long getEpoch() {
        return epoch;
    }

    public Set<BrickId> getBricks() {
        return ImmutableSortedSet.copyOf(bricks);
    }

    public int getBrickCount() {
        return bricks.size();
    }

    public BrickRuntimeInfo getRuntimeInfo() {
        return new BrickRuntimeInfo(fingerprint.getPid(), port);
    }

    boolean addBrick(BrickId brick) {
        return bricks.add(brick);
    }

    boolean removeBrick(BrickId brick) {
        return bricks.remove(brick);
    }

    @Override
    public String toString() {
        return String.format("entry[%s port=%d %s epoch=%d bricks=%d]",
                fingerprint, port, key.getDigest(), epoch, bricks.size());
    }
}
