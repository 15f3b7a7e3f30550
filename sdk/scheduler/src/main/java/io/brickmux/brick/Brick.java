package io.brickmux.brick;

import com.google.common.collect.ImmutableSortedMap;

import java.util.Map;

/**
 * A brick to be placed into a process: its identity and its effective options, which are the cluster-wide options
 * overlaid with the options of its volume.
 */
public final class Brick {

    private final BrickId id;
    private final Map<String, String> effectiveOptions;

    public Brick(BrickId id, Map<String, String> effectiveOptions) {
        this.id = id;
        this.effectiveOptions = ImmutableSortedMap.copyOf(effectiveOptions);
    }

    /**
     * Returns the effective options for a brick, where volume options take precedence over cluster options.
     */
    public static Map<String, String> mergeOptions(Map<String, String> clusterOptions,
                                                   Map<String, String> volumeOptions) {
        ImmutableSortedMap.Builder<String, String> builder = ImmutableSortedMap.naturalOrder();
        for (Map.Entry<String, String> entry : clusterOptions.entrySet()) {
            if (!volumeOptions.containsKey(entry.getKey())) {
                builder.put(entry);
            }
        }
        return builder.putAll(volumeOptions).build();
    }

    public BrickId getId() {
        return id;
    }

    public Map<String, String> getEffectiveOptions() {
        return effectiveOptions;
    }

    @Override
    public String toString() {
        return String.format("%s %s", id, effectiveOptions);
    }
}
