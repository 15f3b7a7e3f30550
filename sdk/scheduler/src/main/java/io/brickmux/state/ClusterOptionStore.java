package io.brickmux.state;

import io.brickmux.storage.Persister;
import io.brickmux.storage.PersisterException;
import io.brickmux.storage.PersisterUtils;
import io.brickmux.storage.StorageError.Reason;
import io.brickmux.util.LoggingUtils;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Persistent storage of cluster-wide options such as {@code cluster.brick-multiplex}. Each option is stored as a
 * UTF-8 value at {@code ClusterOptions/<name>}.
 */
public class ClusterOptionStore {

    private static final Logger LOGGER = LoggingUtils.getLogger(ClusterOptionStore.class);

    private static final String OPTIONS_ROOT_NAME = "ClusterOptions";
    private static final Charset CHARSET = StandardCharsets.UTF_8;

    private final Persister persister;

    public ClusterOptionStore(Persister persister) {
        this.persister = persister;
    }

    /**
     * Stores the provided options in a single write, leaving any other stored options as they are.
     *
     * @throws StateStoreException if an option name is invalid, or if storing the data fails
     */
    public void storeOptions(Map<String, String> options) throws StateStoreException {
        Map<String, byte[]> values = new TreeMap<>();
        for (Map.Entry<String, String> entry : options.entrySet()) {
            validateName(entry.getKey());
            if (entry.getValue() == null) {
                throw new StateStoreException(Reason.LOGIC_ERROR,
                        String.format("Value of option %s must not be null", entry.getKey()));
            }
            values.put(getOptionPath(entry.getKey()), entry.getValue().getBytes(CHARSET));
        }
        try {
            persister.setMany(values);
        } catch (PersisterException e) {
            throw new StateStoreException(e, "Failed to store cluster options");
        }
        LOGGER.info("Stored cluster options: {}", options);
    }

    public void storeOption(String name, String value) throws StateStoreException {
        Map<String, String> options = new TreeMap<>();
        options.put(name, value);
        storeOptions(options);
    }

    /**
     * Returns all stored options, or an empty map if none are stored.
     */
    public Map<String, String> fetchOptions() throws StateStoreException {
        Map<String, String> options = new TreeMap<>();
        try {
            for (String name : PersisterUtils.getChildrenOrEmpty(persister, OPTIONS_ROOT_NAME)) {
                byte[] bytes = persister.get(getOptionPath(name));
                if (bytes != null) {
                    options.put(name, new String(bytes, CHARSET));
                }
            }
        } catch (PersisterException e) {
            throw new StateStoreException(e, "Failed to retrieve cluster options");
        }
        return options;
    }

    public Optional<String> fetchOption(String name) throws StateStoreException {
        validateName(name);
        try {
            byte[] bytes = persister.get(getOptionPath(name));
            return bytes == null ? Optional.empty() : Optional.of(new String(bytes, CHARSET));
        } catch (PersisterException e) {
            if (e.getReason() == Reason.NOT_FOUND) {
                return Optional.empty();
            }
            throw new StateStoreException(e);
        }
    }

    /**
     * Removes an option. Removing an option which isn't stored is a no-op.
     */
    public void clearOption(String name) throws StateStoreException {
        validateName(name);
        try {
            persister.recursiveDelete(getOptionPath(name));
        } catch (PersisterException e) {
            if (e.getReason() != Reason.NOT_FOUND) {
                throw new StateStoreException(e);
            }
        }
    }

    private static void validateName(String name) throws StateStoreException {
        if (StringUtils.isBlank(name)) {
            throw new StateStoreException(Reason.LOGIC_ERROR, "Option name cannot be blank or null");
        }
        if (name.contains(PersisterUtils.PATH_DELIM_STR)) {
            throw new StateStoreException(Reason.LOGIC_ERROR, "Option name cannot contain '/': " + name);
        }
    }

    private static String getOptionPath(String name) {
        return PersisterUtils.joinPaths(OPTIONS_ROOT_NAME, name);
    }
}
