package io.brickmux.framework;

import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Typed access to the scheduler's environment variables. Parse failures are reported as {@link ConfigException}s
 * naming the variable, so that a bad deployment fails at startup with a useful message.
 */
public class EnvStore {

    /**
     * Thrown when a variable is set to a value the scheduler can't use.
     */
    public static class ConfigException extends RuntimeException {

        private final String envKey;

        ConfigException(String envKey, String message) {
            super(String.format("Invalid value of environment variable %s: %s", envKey, message));
            this.envKey = envKey;
        }

        public String getEnvKey() {
            return envKey;
        }
    }

    private final Map<String, String> envMap;

    public static EnvStore fromEnv() {
        return new EnvStore(System.getenv());
    }

    public static EnvStore fromMap(Map<String, String> envMap) {
        return new EnvStore(envMap);
    }

    private EnvStore(Map<String, String> envMap) {
        this.envMap = new HashMap<>(envMap);
    }

    /**
     * Returns the trimmed value, or {@code defaultValue} if the variable is unset or blank.
     */
    public String getOptionalNonEmpty(String envKey, String defaultValue) {
        String value = envMap.get(envKey);
        return StringUtils.isBlank(value) ? defaultValue : value.trim();
    }

    public int getOptionalInt(String envKey, int defaultValue) {
        String value = getOptionalNonEmpty(envKey, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigException(envKey, String.format("'%s' is not an integer", value));
        }
    }

    /**
     * Returns a duration configured as a positive number of milliseconds.
     */
    public Duration getOptionalPositiveMillis(String envKey, long defaultMs) {
        String value = getOptionalNonEmpty(envKey, null);
        if (value == null) {
            return Duration.ofMillis(defaultMs);
        }
        final long millis;
        try {
            millis = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigException(envKey, String.format("'%s' is not a number of milliseconds", value));
        }
        if (millis <= 0) {
            throw new ConfigException(envKey, String.format("%d must be positive", millis));
        }
        return Duration.ofMillis(millis);
    }

    public Optional<File> getOptionalFile(String envKey) {
        return Optional.ofNullable(getOptionalNonEmpty(envKey, null)).map(File::new);
    }

    /**
     * Returns whether the variable is set at all, even to an empty value.
     */
    public boolean isPresent(String envKey) {
        return envMap.containsKey(envKey);
    }
}
