package io.brickmux.state;

import io.brickmux.brick.BrickId;
import io.brickmux.brick.BrickRuntime;
import io.brickmux.storage.Persister;
import io.brickmux.storage.PersisterException;
import io.brickmux.storage.PersisterUtils;
import io.brickmux.storage.StorageError.Reason;
import io.brickmux.util.LoggingUtils;

import org.slf4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Persistent storage of volume definitions and brick runtime records, on top of a {@link Persister}.
 *
 * <p>Layout:
 * <ul><li>{@code Volumes/<volume>/Options}: JSON object of volume options</li>
 * <li>{@code Volumes/<volume>/<peer:path>/Brick}: JSON brick definition</li>
 * <li>{@code Volumes/<volume>/<peer:path>/Runtime}: JSON {@link BrickRuntime}</li></ul>
 * where slashes in {@code peer:path} are escaped.
 */
public class BrickStore {

    private static final Logger LOGGER = LoggingUtils.getLogger(BrickStore.class);

    private static final String VOLUMES_ROOT_NAME = "Volumes";
    private static final String OPTIONS_PATH_NAME = "Options";
    private static final String BRICK_PATH_NAME = "Brick";
    private static final String RUNTIME_PATH_NAME = "Runtime";

    private final Persister persister;

    public BrickStore(Persister persister) {
        this.persister = persister;
    }

    // Write volumes

    /**
     * Stores the options and brick definitions of a volume in a single write. Any previous options are replaced, and
     * the runtime records of existing bricks are left as they are.
     *
     * @throws StateStoreException if a brick belongs to another volume, or if storing the data fails
     */
    public void storeVolume(String volume, Map<String, String> options, Collection<BrickId> bricks)
            throws StateStoreException {
        Map<String, byte[]> values = new TreeMap<>();
        try {
            values.put(getOptionsPath(volume), RecordCodec.encode(new TreeMap<>(options)));
            for (BrickId brick : bricks) {
                if (!brick.getVolume().equals(volume)) {
                    throw new StateStoreException(Reason.LOGIC_ERROR, String.format(
                            "Brick %s does not belong to volume %s", brick, volume));
                }
                values.put(getBrickPath(brick), RecordCodec.encode(brick));
            }
        } catch (IOException e) {
            throw new StateStoreException(Reason.SERIALIZATION_ERROR,
                    String.format("Failed to serialize volume %s", volume), e);
        }
        try {
            persister.setMany(values);
        } catch (PersisterException e) {
            throw new StateStoreException(e, String.format("Failed to store volume %s", volume));
        }
        LOGGER.info("Stored volume {} with {} bricks and {} options", volume, bricks.size(), options.size());
    }

    /**
     * Removes a volume and all of its brick records. Deleting a nonexistent volume is a no-op.
     */
    public void deleteVolume(String volume) throws StateStoreException {
        try {
            persister.recursiveDelete(getVolumePath(volume));
        } catch (PersisterException e) {
            if (e.getReason() == Reason.NOT_FOUND) {
                LOGGER.warn("Deleted nonexistent volume, continuing silently: {}", volume);
            } else {
                throw new StateStoreException(e);
            }
        }
    }

    // Read volumes

    /**
     * Returns the names of all stored volumes, or an empty list if none are found.
     */
    public Collection<String> fetchVolumeNames() throws StateStoreException {
        try {
            return new ArrayList<>(PersisterUtils.getChildrenOrEmpty(persister, VOLUMES_ROOT_NAME));
        } catch (PersisterException e) {
            throw new StateStoreException(e);
        }
    }

    public boolean hasVolume(String volume) throws StateStoreException {
        return fetchVolumeNames().contains(volume);
    }

    /**
     * Returns the options of the provided volume, or an empty map if the volume has none.
     *
     * @throws StateStoreException with {@link Reason#NOT_FOUND} if the volume doesn't exist
     */
    @SuppressWarnings("unchecked")
    public Map<String, String> fetchVolumeOptions(String volume) throws StateStoreException {
        requireVolume(volume);
        try {
            byte[] bytes = persister.get(getOptionsPath(volume));
            if (bytes == null || bytes.length == 0) {
                return Collections.emptyMap();
            }
            return RecordCodec.decode(bytes, TreeMap.class);
        } catch (PersisterException e) {
            if (e.getReason() == Reason.NOT_FOUND) {
                return Collections.emptyMap();
            }
            throw new StateStoreException(e);
        } catch (IOException e) {
            throw new StateStoreException(Reason.SERIALIZATION_ERROR,
                    String.format("Failed to parse options of volume %s", volume), e);
        }
    }

    /**
     * Returns the bricks defined for the provided volume, in a consistent order.
     *
     * @throws StateStoreException with {@link Reason#NOT_FOUND} if the volume doesn't exist
     */
    public List<BrickId> fetchBrickIds(String volume) throws StateStoreException {
        requireVolume(volume);
        List<BrickId> bricks = new ArrayList<>();
        try {
            for (String child : persister.getChildren(getVolumePath(volume))) {
                if (OPTIONS_PATH_NAME.equals(child)) {
                    continue;
                }
                byte[] bytes = persister.get(
                        PersisterUtils.joinPaths(getVolumePath(volume), child, BRICK_PATH_NAME));
                if (bytes == null || bytes.length == 0) {
                    throw new StateStoreException(Reason.SERIALIZATION_ERROR, String.format(
                            "Empty brick definition at %s in volume %s", child, volume));
                }
                bricks.add(RecordCodec.decode(bytes, BrickId.class));
            }
        } catch (PersisterException e) {
            throw new StateStoreException(e, String.format("Failed to retrieve bricks of volume %s", volume));
        } catch (IOException e) {
            throw new StateStoreException(Reason.SERIALIZATION_ERROR,
                    String.format("Failed to parse bricks of volume %s", volume), e);
        }
        Collections.sort(bricks);
        return bricks;
    }

    // Read/Write runtime records

    /**
     * Stores the runtime record of a defined brick. The record is dropped if the brick's definition is gone, which
     * happens when a process exit is reported after its volume was deleted.
     *
     * @return whether the record was stored
     * @throws StateStoreException if storing the data fails
     */
    public boolean storeRuntime(BrickId brick, BrickRuntime runtime) throws StateStoreException {
        try {
            boolean stored = persister.setManyIfPresent(getBrickPath(brick),
                    Collections.singletonMap(getRuntimePath(brick), RecordCodec.encode(runtime)));
            if (!stored) {
                LOGGER.info("Dropped {} runtime of {}, which is no longer defined", runtime.getState(), brick);
            }
            return stored;
        } catch (PersisterException e) {
            throw new StateStoreException(e, String.format("Failed to store runtime of brick %s", brick));
        } catch (IOException e) {
            throw new StateStoreException(Reason.SERIALIZATION_ERROR,
                    String.format("Failed to serialize runtime of brick %s", brick), e);
        }
    }

    /**
     * Returns the runtime record of a brick, or a {@link io.brickmux.brick.BrickState#NOT_STARTED} record if none is
     * stored.
     */
    public BrickRuntime fetchRuntime(BrickId brick) throws StateStoreException {
        try {
            byte[] bytes = persister.get(getRuntimePath(brick));
            if (bytes == null || bytes.length == 0) {
                return BrickRuntime.notStarted();
            }
            return RecordCodec.decode(bytes, BrickRuntime.class);
        } catch (PersisterException e) {
            if (e.getReason() == Reason.NOT_FOUND) {
                return BrickRuntime.notStarted();
            }
            throw new StateStoreException(e, String.format("Failed to retrieve runtime of brick %s", brick));
        } catch (IOException e) {
            throw new StateStoreException(Reason.SERIALIZATION_ERROR,
                    String.format("Failed to parse runtime of brick %s", brick), e);
        }
    }

    /**
     * Returns the runtime records of every defined brick across all volumes.
     */
    public Map<BrickId, BrickRuntime> fetchAllRuntimes() throws StateStoreException {
        Map<BrickId, BrickRuntime> runtimes = new TreeMap<>();
        for (String volume : fetchVolumeNames()) {
            for (BrickId brick : fetchBrickIds(volume)) {
                runtimes.put(brick, fetchRuntime(brick));
            }
        }
        return runtimes;
    }

    private void requireVolume(String volume) throws StateStoreException {
        if (!hasVolume(volume)) {
            throw new StateStoreException(Reason.NOT_FOUND, String.format("Volume %s does not exist", volume));
        }
    }

    private static String getVolumePath(String volume) {
        return PersisterUtils.joinPaths(VOLUMES_ROOT_NAME, volume);
    }

    private static String getOptionsPath(String volume) {
        return PersisterUtils.joinPaths(getVolumePath(volume), OPTIONS_PATH_NAME);
    }

    private static String getBrickPath(BrickId brick) {
        return PersisterUtils.joinPaths(getVolumePath(brick.getVolume()), brick.getStorageName(), BRICK_PATH_NAME);
    }

    private static String getRuntimePath(BrickId brick) {
        return PersisterUtils.joinPaths(getVolumePath(brick.getVolume()), brick.getStorageName(), RUNTIME_PATH_NAME);
    }
}
