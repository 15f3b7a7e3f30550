package io.brickmux.storage;

import io.brickmux.state.CycleDetectingLockUtils;
import io.brickmux.storage.StorageError.Reason;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

import java.util.Collection;
import java.util.Map;
import java.util.NavigableMap;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;

/**
 * {@link Persister} held in process memory, used when no ZooKeeper connection is configured and in tests. Every
 * node is a key in one map sorted by normalized path, so that the descendants of {@code a/b} are exactly the keys
 * between {@code a/b/} and {@code a/b0}. Like ZooKeeper, ancestors created by a write stay until deleted.
 */
public final class MemPersister implements Persister {

    private static final Splitter PATH_SPLITTER = Splitter.on(PersisterUtils.PATH_DELIM).omitEmptyStrings();
    private static final Joiner PATH_JOINER = Joiner.on(PersisterUtils.PATH_DELIM);

    // '0' sorts immediately after '/'
    private static final char AFTER_DELIM = PersisterUtils.PATH_DELIM + 1;

    private final NavigableMap<String, byte[]> records = new TreeMap<>();
    private final Lock readLock;
    private final Lock writeLock;

    private MemPersister(boolean exitOnDeadlock) {
        ReadWriteLock lock = CycleDetectingLockUtils.newLock(exitOnDeadlock, MemPersister.class);
        this.readLock = lock.readLock();
        this.writeLock = lock.writeLock();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public byte[] get(String path) throws PersisterException {
        String key = normalize(path);
        readLock.lock();
        try {
            if (!exists(key)) {
                throw PersisterException.notFound(path);
            }
            return records.get(key);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public Collection<String> getChildren(String path) throws PersisterException {
        String key = normalize(path);
        readLock.lock();
        try {
            if (!exists(key)) {
                throw PersisterException.notFound(path);
            }
            SortedMap<String, byte[]> below = key.isEmpty() ? records : descendants(key);
            int offset = key.isEmpty() ? 0 : key.length() + 1;
            Collection<String> children = new TreeSet<>();
            for (String descendant : below.keySet()) {
                int end = descendant.indexOf(PersisterUtils.PATH_DELIM, offset);
                children.add(end < 0 ? descendant.substring(offset) : descendant.substring(offset, end));
            }
            return children;
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public void setMany(Map<String, byte[]> values) throws PersisterException {
        writeLock.lock();
        try {
            write(values);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean setManyIfPresent(String requiredPath, Map<String, byte[]> values) throws PersisterException {
        String requiredKey = normalize(requiredPath);
        writeLock.lock();
        try {
            if (!exists(requiredKey)) {
                return false;
            }
            write(values);
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void recursiveDelete(String path) throws PersisterException {
        String key = normalize(path);
        if (key.isEmpty()) {
            throw new PersisterException(Reason.LOGIC_ERROR, "The root node cannot be deleted");
        }
        writeLock.lock();
        try {
            if (!exists(key)) {
                throw PersisterException.notFound(path);
            }
            records.remove(key);
            descendants(key).clear();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void close() {
        writeLock.lock();
        try {
            records.clear();
        } finally {
            writeLock.unlock();
        }
    }

    private void write(Map<String, byte[]> values) throws PersisterException {
        Map<String, byte[]> normalized = new TreeMap<>();
        for (Map.Entry<String, byte[]> entry : values.entrySet()) {
            String key = normalize(entry.getKey());
            if (key.isEmpty()) {
                throw new PersisterException(Reason.LOGIC_ERROR, "Data cannot be stored in the root node");
            }
            byte[] data = entry.getValue();
            normalized.put(key, data == null || data.length == 0 ? null : data.clone());
        }
        for (Map.Entry<String, byte[]> entry : normalized.entrySet()) {
            for (String parent : PersisterUtils.getParentPaths(entry.getKey())) {
                if (!records.containsKey(parent)) {
                    records.put(parent, null);
                }
            }
            records.put(entry.getKey(), entry.getValue());
        }
    }

    private boolean exists(String key) {
        return key.isEmpty() || records.containsKey(key);
    }

    private SortedMap<String, byte[]> descendants(String key) {
        return records.subMap(key + PersisterUtils.PATH_DELIM, key + AFTER_DELIM);
    }

    private static String normalize(String path) {
        return PATH_JOINER.join(PATH_SPLITTER.split(path));
    }

    /**
     * Builder for {@link MemPersister}s.
     */
    public static final class Builder {
        private boolean exitOnDeadlock = true;

        private Builder() {
        }

        /**
         * Whether a lock cycle detected on this instance exits the process. Enabled by default.
         */
        public Builder setExitOnDeadlock(boolean exitOnDeadlock) {
            this.exitOnDeadlock = exitOnDeadlock;
            return this;
        }

        public MemPersister build() {
            return new MemPersister(exitOnDeadlock);
        }
    }
}
