package io.brickmux.mux;

import io.brickmux.brick.Brick;

import com.google.common.collect.ImmutableSet;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Maps a brick's effective options to the {@link CompatibilityKey} of the process group it may join. Deterministic
 * and free of side effects.
 *
 * <p>Only mux-sensitive options (see {@link MuxOptionsConfig}) contribute to the key. Boolean spellings are normalized
 * to {@code on}/{@code off}, and options set to their default value are left out, so that setting an option to its
 * default is the same as not setting it. When {@code cluster.brick-multiplex} is not on, every brick gets its own
 * standalone key.
 */
public class CompatibilityClassifier {

    private static final Set<String> TRUE_VALUES = ImmutableSet.of("on", "yes", "true", "enable", "1");
    private static final Set<String> FALSE_VALUES = ImmutableSet.of("off", "no", "false", "disable", "0");

    private static final String ON = "on";
    private static final String OFF = "off";

    private final MuxOptionsConfig config;

    public CompatibilityClassifier(MuxOptionsConfig config) {
        this.config = config;
    }

    public CompatibilityKey classify(Brick brick) {
        Map<String, String> options = brick.getEffectiveOptions();
        if (!isMultiplexEnabled(options)) {
            return CompatibilityKey.standalone(brick.getId());
        }
        Map<String, String> keyOptions = new TreeMap<>();
        for (Map.Entry<String, String> entry : options.entrySet()) {
            String name = entry.getKey();
            if (!config.isMuxSensitive(name)) {
                continue;
            }
            String value = normalize(entry.getValue());
            Optional<String> defaultValue = config.getDefault(name);
            if (defaultValue.isPresent() && normalize(defaultValue.get()).equals(value)) {
                continue;
            }
            keyOptions.put(name, value);
        }
        return CompatibilityKey.shared(keyOptions);
    }

    /**
     * Returns whether the provided effective options turn on multiplexing. Multiplexing is off unless enabled.
     */
    public static boolean isMultiplexEnabled(Map<String, String> effectiveOptions) {
        String value = effectiveOptions.get(MuxOptionsConfig.BRICK_MULTIPLEX_OPTION);
        return value != null && ON.equals(normalize(value));
    }

    /**
     * Trims the value, and maps boolean spellings to {@code on} or {@code off}.
     */
    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(lower)) {
            return ON;
        }
        if (FALSE_VALUES.contains(lower)) {
            return OFF;
        }
        return trimmed;
    }
}
