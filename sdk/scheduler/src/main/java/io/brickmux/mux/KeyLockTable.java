package io.brickmux.mux;

import io.brickmux.state.CycleDetectingLockUtils;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per {@link CompatibilityKey}. Locks are created on first use and kept, since the number of distinct keys
 * in a cluster is small.
 */
public class KeyLockTable {

    private final ConcurrentMap<CompatibilityKey, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final boolean exitOnDeadlock;

    public KeyLockTable(boolean exitOnDeadlock) {
        this.exitOnDeadlock = exitOnDeadlock;
    }

    public ReentrantLock getLock(CompatibilityKey key) {
        return locks.computeIfAbsent(key,
                k -> CycleDetectingLockUtils.newReentrantLock(exitOnDeadlock, "key-" + k.getDigest()));
    }

    public boolean isHeldByCurrentThread(CompatibilityKey key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isHeldByCurrentThread();
    }
}
