package io.brickmux.curator;

import io.brickmux.storage.Persister;
import io.brickmux.storage.PersisterException;
import io.brickmux.storage.PersisterUtils;
import io.brickmux.storage.StorageError.Reason;
import io.brickmux.util.LoggingUtils;

import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.framework.api.transaction.CuratorOp;
import org.apache.zookeeper.KeeperException;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * {@link Persister} backed by ZooKeeper, so that volume definitions and brick runtime records survive a scheduler
 * restart. Every path is placed under a per-cluster root node, see {@link CuratorUtils#getRootPath(String)}.
 * Multi-node writes are ZooKeeper transactions.
 */
public class CuratorPersister implements Persister {

    private static final Logger LOGGER = LoggingUtils.getLogger(CuratorPersister.class);

    // a transaction only fails on connection loss or when another writer changed the nodes it checked
    private static final int ATOMIC_WRITE_ATTEMPTS = 3;

    // otherwise Curator fills created parents with the local address
    private static final byte[] NO_DATA = new byte[0];

    private final String rootPath;
    private final CuratorFramework client;

    /**
     * Builder for {@link CuratorPersister}s.
     */
    public static final class Builder {
        private final String clusterName;
        private final String connectionString;

        private Builder(String clusterName, String connectionString) {
            this.clusterName = clusterName;
            this.connectionString = connectionString;
        }

        /**
         * Connects to ZooKeeper and claims the cluster's root node.
         *
         * @throws IllegalArgumentException if the root node is already owned by a differently spelled cluster name
         */
        public CuratorPersister build() {
            CuratorPersister persister = new CuratorPersister(clusterName,
                    CuratorFrameworkFactory.newClient(connectionString, CuratorUtils.getDefaultRetry()));
            CuratorUtils.initClusterName(persister, clusterName);
            return persister;
        }
    }

    /**
     * @param clusterName name of the cluster whose state is stored, e.g. {@code gluster-east}
     * @param connectionString ZooKeeper connection string, e.g. {@code zk-1:2181,zk-2:2181}
     */
    public static Builder newBuilder(String clusterName, String connectionString) {
        return new Builder(clusterName, connectionString);
    }

    private CuratorPersister(String clusterName, CuratorFramework client) {
        this.rootPath = CuratorUtils.getRootPath(clusterName);
        this.client = client;
        this.client.start();
    }

    @Override
    public byte[] get(String path) throws PersisterException {
        String absolutePath = toAbsolute(path);
        try {
            byte[] data = client.getData().forPath(absolutePath);
            return data == null || data.length == 0 ? null : data;
        } catch (KeeperException.NoNodeException e) {
            if (absolutePath.equals(rootPath)) {
                return null;
            }
            throw PersisterException.notFound(absolutePath);
        } catch (Exception e) {
            throw new PersisterException(Reason.STORAGE_ERROR, "Failed to read " + absolutePath, e);
        }
    }

    @Override
    public Collection<String> getChildren(String path) throws PersisterException {
        String absolutePath = toAbsolute(path);
        try {
            return new TreeSet<>(client.getChildren().forPath(absolutePath));
        } catch (KeeperException.NoNodeException e) {
            if (absolutePath.equals(rootPath)) {
                return new TreeSet<>();
            }
            throw PersisterException.notFound(absolutePath);
        } catch (Exception e) {
            throw new PersisterException(Reason.STORAGE_ERROR, "Failed to list " + absolutePath, e);
        }
    }

    @Override
    public void setMany(Map<String, byte[]> values) throws PersisterException {
        commit(null, values);
    }

    @Override
    public boolean setManyIfPresent(String requiredPath, Map<String, byte[]> values) throws PersisterException {
        return commit(toAbsolute(requiredPath), values);
    }

    @Override
    public void recursiveDelete(String path) throws PersisterException {
        String absolutePath = toAbsolute(path);
        if (absolutePath.equals(rootPath)) {
            throw new PersisterException(Reason.LOGIC_ERROR, "The root node cannot be deleted");
        }
        LOGGER.debug("Deleting {} and its children", absolutePath);
        try {
            client.delete().deletingChildrenIfNeeded().forPath(absolutePath);
        } catch (KeeperException.NoNodeException e) {
            throw PersisterException.notFound(absolutePath);
        } catch (Exception e) {
            throw new PersisterException(Reason.STORAGE_ERROR, "Failed to delete " + absolutePath, e);
        }
    }

    @Override
    public void close() {
        client.close();
    }

    /**
     * Writes the values in one transaction, retrying failed attempts. With a {@code requiredPath}, the transaction
     * also checks that node, and nothing is written once it's gone.
     */
    private boolean commit(String requiredPath, Map<String, byte[]> values) throws PersisterException {
        // sorted so that parents are created ahead of their children
        Map<String, byte[]> absoluteValues = new TreeMap<>();
        for (Map.Entry<String, byte[]> entry : values.entrySet()) {
            absoluteValues.put(toAbsolute(entry.getKey()), entry.getValue() == null ? NO_DATA : entry.getValue());
        }
        LOGGER.debug("Writing {}", absoluteValues.keySet());
        for (int attempt = 1; ; ++attempt) {
            try {
                if (requiredPath != null && client.checkExists().forPath(requiredPath) == null) {
                    LOGGER.debug("Skipping write of {}: {} is gone", absoluteValues.keySet(), requiredPath);
                    return false;
                }
                List<CuratorOp> ops = new ArrayList<>();
                if (requiredPath != null) {
                    ops.add(client.transactionOp().check().forPath(requiredPath));
                }
                ops.addAll(buildWriteOps(absoluteValues));
                if (!ops.isEmpty()) {
                    client.transaction().forOperations(ops);
                }
                return true;
            } catch (Exception e) {
                if (attempt >= ATOMIC_WRITE_ATTEMPTS) {
                    throw new PersisterException(Reason.STORAGE_ERROR,
                            String.format("Failed to write %s after %d attempts", absoluteValues.keySet(), attempt), e);
                }
                LOGGER.warn("Write attempt {}/{} of {} failed: {}",
                        attempt, ATOMIC_WRITE_ATTEMPTS, absoluteValues.keySet(), e.getMessage());
            }
        }
    }

    /**
     * Returns create operations for missing nodes, including their missing ancestors, and setData operations for
     * nodes which already exist.
     */
    private List<CuratorOp> buildWriteOps(Map<String, byte[]> absoluteValues) throws Exception {
        Set<String> knownPaths = new HashSet<>();
        List<CuratorOp> ops = new ArrayList<>();
        for (Map.Entry<String, byte[]> entry : absoluteValues.entrySet()) {
            String path = entry.getKey();
            if (knownPaths.contains(path) || client.checkExists().forPath(path) != null) {
                ops.add(client.transactionOp().setData().forPath(path, entry.getValue()));
                continue;
            }
            for (String parent : PersisterUtils.getParentPaths(path)) {
                if (knownPaths.add(parent) && client.checkExists().forPath(parent) == null) {
                    ops.add(client.transactionOp().create().forPath(parent, NO_DATA));
                }
            }
            ops.add(client.transactionOp().create().forPath(path, entry.getValue()));
            knownPaths.add(path);
        }
        return ops;
    }

    /**
     * Maps a caller's path into the cluster root: {@code "Volumes/v1"} => {@code "/brickmux-c1/Volumes/v1"}. Every
     * caller-provided path must pass through here.
     */
    private String toAbsolute(String path) {
        return PersisterUtils.joinPaths(rootPath, path);
    }
}
