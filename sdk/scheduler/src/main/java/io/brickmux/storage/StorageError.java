package io.brickmux.storage;

/**
 * Holder of the {@link Reason} shared by {@link PersisterException} and {@link io.brickmux.state.StateStoreException}.
 */
public final class StorageError {

    private StorageError() {
        // do not instantiate
    }

    /**
     * Why a read or write of scheduler state failed. The HTTP layer answers 404 for {@link #NOT_FOUND}, 400 for
     * {@link #LOGIC_ERROR} and 500 otherwise.
     */
    public enum Reason {

        /**
         * No volume, brick record or option exists at the requested location.
         */
        NOT_FOUND,

        /**
         * The backing store (ZooKeeper or memory) could not complete the operation.
         */
        STORAGE_ERROR,

        /**
         * A stored record could not be encoded to or decoded from JSON.
         */
        SERIALIZATION_ERROR,

        /**
         * The caller asked for something that can never succeed, such as a brick listed under a foreign volume.
         */
        LOGIC_ERROR
    }
}
