package io.brickmux.storage;

import java.util.Collection;
import java.util.Map;

/**
 * Tree of byte records backing the volume, brick runtime and cluster option stores. Paths are made of node names
 * joined with {@link PersisterUtils#PATH_DELIM}. A node may hold data, children, or both. Writing a node implicitly
 * creates any missing ancestors without data of their own.
 */
public interface Persister {

    /**
     * Returns the data of the node at {@code path}, or {@code null} for a node which only exists as the ancestor of
     * other nodes.
     *
     * @throws PersisterException with {@link StorageError.Reason#NOT_FOUND} if no such node exists
     */
    byte[] get(String path) throws PersisterException;

    /**
     * Returns the names of the direct children of {@code path}, sorted.
     *
     * @throws PersisterException with {@link StorageError.Reason#NOT_FOUND} if no such node exists
     */
    Collection<String> getChildren(String path) throws PersisterException;

    /**
     * Writes all of the provided path/data pairs as a single atomic update. On failure nothing is written.
     */
    void setMany(Map<String, byte[]> values) throws PersisterException;

    /**
     * Same as {@link #setMany(Map)}, but only writes if the node at {@code requiredPath} exists at the time of the
     * update. The check and the write are atomic with respect to {@link #recursiveDelete(String)}.
     *
     * @return whether the values were written
     */
    boolean setManyIfPresent(String requiredPath, Map<String, byte[]> values) throws PersisterException;

    /**
     * Deletes the node at {@code path} along with everything below it. The root may not be deleted.
     *
     * @throws PersisterException with {@link StorageError.Reason#NOT_FOUND} if no such node exists
     */
    void recursiveDelete(String path) throws PersisterException;

    void close();
}
