package io.brickmux.curator;

import io.brickmux.storage.Persister;
import io.brickmux.storage.PersisterException;
import io.brickmux.storage.PersisterUtils;
import io.brickmux.storage.StorageError.Reason;

import org.apache.curator.RetryPolicy;
import org.apache.curator.retry.ExponentialBackoffRetry;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collections;

/**
 * A set of common utilites for managing Curator/Zookeeper paths and data.
 */
public class CuratorUtils {

    private static final int DEFAULT_CURATOR_POLL_DELAY_MS = 1000;
    private static final int DEFAULT_CURATOR_MAX_RETRIES = 3;

    /**
     * Name to use for storing a reverse mapping of the cluster name. This is lowercased as it's handled in the
     * underlying Persister layer, whereas common storage handling in the {@code state} package is PascalCased.
     */
    private static final String CLUSTER_NAME_NODE = "clustername";

    /**
     * This must never change, as it affects the path to all stored data for a given cluster name.
     */
    private static final String ROOT_PATH_PREFIX = "/brickmux-";

    /**
     * This must never change, as it affects the serialization of the cluster name node.
     */
    private static final Charset CLUSTER_NAME_CHARSET = StandardCharsets.UTF_8;

    private CuratorUtils() {
        // do not instantiate
    }

    /**
     * Returns the root node to store all ZK data inside. For example:
     *
     * <ul>
     * <li>"your-name-here" => /brickmux-your-name-here</li>
     * <li>"/path/to/your-name-here" => /brickmux-path__to__your-name-here</li>
     * </ul>
     */
    public static String getRootPath(String clusterName) {
        return ROOT_PATH_PREFIX + PersisterUtils.withEscapedSlashes(clusterName);
    }

    /**
     * Returns a reasonable default retry policy for querying ZK.
     */
    static RetryPolicy getDefaultRetry() {
        return new ExponentialBackoffRetry(DEFAULT_CURATOR_POLL_DELAY_MS, DEFAULT_CURATOR_MAX_RETRIES);
    }

    /**
     * Compares the cluster name to the previously stored name in zookeeper, or creates a new node containing this data
     * if it isn't already present. This protects against collisions between a foldered name like "/team/storage" and
     * a literal "team__storage", which both map to the same root node.
     *
     * @param persister the persister where the name should be written
     * @param clusterName the name to check for equality, or to write if no name node exists
     * @see CuratorUtils#getRootPath(String)
     */
    static void initClusterName(Persister persister, String clusterName) {
        try {
            byte[] bytes = persister.get(CLUSTER_NAME_NODE);
            if (bytes == null || bytes.length == 0) {
                throw new IllegalArgumentException(String.format(
                        "Invalid data when fetching cluster name in '%s'", CLUSTER_NAME_NODE));
            }
            String currentName = new String(bytes, CLUSTER_NAME_CHARSET);
            if (!currentName.equals(clusterName)) {
                throw new IllegalArgumentException(String.format(
                        "Collision between similar cluster names: Expected name '%s', but stored name is '%s'.",
                        clusterName, currentName));
            }
        } catch (PersisterException e) {
            if (e.getReason() == Reason.NOT_FOUND) {
                // New install: initialize.
                try {
                    persister.setMany(Collections.singletonMap(
                            CLUSTER_NAME_NODE, clusterName.getBytes(CLUSTER_NAME_CHARSET)));
                } catch (PersisterException e2) {
                    throw new IllegalStateException("Failed to store cluster name", e2);
                }
            } else {
                throw new IllegalStateException("Failed to fetch prior cluster name for validation", e);
            }
        }
    }
}
