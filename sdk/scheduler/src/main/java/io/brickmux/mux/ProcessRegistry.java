package io.brickmux.mux;

import io.brickmux.brick.BrickId;
import io.brickmux.util.LoggingUtils;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * In-memory table of running brick-server processes, keyed by {@link CompatibilityKey}, with reverse lookups by PID
 * and by brick. Rebuilt from persisted state on restart.
 *
 * <p>Every mutation requires the caller to hold the lock of the affected key (see {@link #getLock(CompatibilityKey)}).
 * There is no lock across keys.
 *
 * <p>A key normally has a single entry. More can exist after forced starts or when a per-process brick limit is set;
 * the newest one is the attachment point for new bricks.
 */
public class ProcessRegistry {

    private static final Logger LOGGER = LoggingUtils.getLogger(ProcessRegistry.class);

    private final KeyLockTable locks;

    /**
     * Entries for each key, newest first.
     */
    private final ConcurrentMap<CompatibilityKey, List<ProcessEntry>> entriesByKey = new ConcurrentHashMap<>();
    private final ConcurrentMap<Long, ProcessEntry> entriesByPid = new ConcurrentHashMap<>();
    private final ConcurrentMap<BrickId, ProcessEntry> entriesByBrick = new ConcurrentHashMap<>();

    /**
     * The epoch at which each brick last went offline.
     */
    private final ConcurrentMap<BrickId, Long> offlineEpochs = new ConcurrentHashMap<>();
    private final AtomicLong epochCounter = new AtomicLong();

    public ProcessRegistry(KeyLockTable locks) {
        this.locks = locks;
    }

    public ReentrantLock getLock(CompatibilityKey key) {
        return locks.getLock(key);
    }

    /**
     * Returns a new epoch, larger than any returned before.
     */
    public long newEpoch() {
        return epochCounter.incrementAndGet();
    }

    // Lookups

    /**
     * Returns the attachment point for the key: its newest entry.
     */
    public Optional<ProcessEntry> lookup(CompatibilityKey key) {
        return lookup(key, entry -> true);
    }

    /**
     * Returns the newest entry for the key which passes the filter.
     */
    public Optional<ProcessEntry> lookup(CompatibilityKey key, Predicate<ProcessEntry> filter) {
        for (ProcessEntry entry : lookupAll(key)) {
            if (filter.test(entry)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns all entries for the key, newest first.
     */
    public List<ProcessEntry> lookupAll(CompatibilityKey key) {
        List<ProcessEntry> entries = entriesByKey.get(key);
        return entries == null ? Collections.emptyList() : ImmutableList.copyOf(entries);
    }

    public Optional<ProcessEntry> lookupByPid(long pid) {
        return Optional.ofNullable(entriesByPid.get(pid));
    }

    public Optional<ProcessEntry> lookupByBrick(BrickId brick) {
        return Optional.ofNullable(entriesByBrick.get(brick));
    }

    public boolean contains(ProcessEntry entry) {
        List<ProcessEntry> entries = entriesByKey.get(entry.getKey());
        return entries != null && entries.contains(entry);
    }

    /**
     * Returns a snapshot of all entries.
     */
    public List<ProcessEntry> getEntries() {
        List<ProcessEntry> all = new ArrayList<>();
        for (List<ProcessEntry> entries : entriesByKey.values()) {
            all.addAll(entries);
        }
        return all;
    }

    // Mutations

    /**
     * Adds a new entry, which becomes the attachment point of its key.
     */
    public void insert(ProcessEntry entry) {
        checkLocked(entry.getKey());
        entriesByKey.computeIfAbsent(entry.getKey(), k -> new CopyOnWriteArrayList<>()).add(0, entry);
        ProcessEntry previous = entriesByPid.put(entry.getPid(), entry);
        if (previous != null && previous != entry) {
            LOGGER.warn("PID {} reused: {} replaces {}", entry.getPid(), entry, previous);
        }
        LOGGER.info("Registered {} for {}", entry, entry.getKey());
    }

    public void attachBrick(ProcessEntry entry, BrickId brick) {
        checkLocked(entry.getKey());
        Preconditions.checkState(contains(entry), "Entry is not registered: %s", entry);
        ProcessEntry previous = entriesByBrick.get(brick);
        Preconditions.checkState(previous == null || previous == entry,
                "Brick %s is already attached to %s", brick, previous);
        entry.addBrick(brick);
        entriesByBrick.put(brick, entry);
        offlineEpochs.remove(brick);
    }

    /**
     * Detaches a brick from its entry, removing the entry if this was its last brick.
     *
     * @return whether the entry was removed
     */
    public boolean detachBrick(ProcessEntry entry, BrickId brick) {
        checkLocked(entry.getKey());
        if (entry.removeBrick(brick)) {
            entriesByBrick.remove(brick, entry);
        }
        if (entry.getBrickCount() == 0) {
            remove(entry);
            return true;
        }
        return false;
    }

    /**
     * Removes an entry and detaches all of its bricks.
     *
     * @return the bricks which were attached
     */
    public Set<BrickId> remove(ProcessEntry entry) {
        checkLocked(entry.getKey());
        Set<BrickId> bricks = entry.getBricks();
        for (BrickId brick : bricks) {
            entry.removeBrick(brick);
            entriesByBrick.remove(brick, entry);
        }
        entriesByPid.remove(entry.getPid(), entry);
        entriesByKey.computeIfPresent(entry.getKey(), (k, entries) -> {
            entries.remove(entry);
            return entries.isEmpty() ? null : entries;
        });
        LOGGER.info("Removed {} ({} bricks detached)", entry, bricks.size());
        return bricks;
    }

    /**
     * Records that the brick went offline now. Forced starts of the brick won't reuse entries which existed before
     * this point.
     */
    public void markOffline(BrickId brick) {
        offlineEpochs.put(brick, epochCounter.get());
    }

    /**
     * Returns the epoch at which the brick last went offline, or zero if it never did.
     */
    public long getOfflineEpoch(BrickId brick) {
        return offlineEpochs.getOrDefault(brick, 0L);
    }

    /**
     * Drops all state. Only used while no other operations are running, before the registry is rebuilt.
     */
    public void clear() {
        entriesByKey.clear();
        entriesByPid.clear();
        entriesByBrick.clear();
        offlineEpochs.clear();
        epochCounter.set(0);
    }

    private void checkLocked(CompatibilityKey key) {
        Preconditions.checkState(locks.isHeldByCurrentThread(key), "Lock for %s is not held", key);
    }
}
