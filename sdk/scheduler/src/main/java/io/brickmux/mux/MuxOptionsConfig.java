package io.brickmux.mux;

import io.brickmux.config.SerializationUtils;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The list of mux-sensitive options: options whose values must match for two bricks to share a process. Each rule is
 * either an exact option name ({@code write-behind.trickling-writes}) or a prefix ending in {@code .*}
 * ({@code io-threads.*}), and may declare the value an option takes when it isn't set.
 *
 * <p>Loaded from YAML:
 * <pre>
 * mux-sensitive-options:
 *   - name: write-behind.trickling-writes
 *     default: "off"
 *   - name: io-threads.*
 * </pre>
 */
public final class MuxOptionsConfig {

    /**
     * Cluster option which turns multiplexing on or off.
     */
    public static final String BRICK_MULTIPLEX_OPTION = "cluster.brick-multiplex";

    /**
     * Cluster option which limits the number of bricks attached to one process. {@code 0} means no limit.
     */
    public static final String MAX_BRICKS_PER_PROCESS_OPTION = "cluster.max-bricks-per-process";

    /**
     * Classpath resource holding the default rules.
     */
    public static final String DEFAULT_RESOURCE = "brickmux-options.yml";

    private static final String PREFIX_SUFFIX = ".*";

    private final List<Rule> rules;

    @JsonCreator
    public MuxOptionsConfig(@JsonProperty("mux-sensitive-options") List<Rule> rules) {
        this.rules = rules == null ? Collections.emptyList() : ImmutableList.copyOf(rules);
    }

    /**
     * Loads rules from the provided file.
     *
     * @throws IOException if the file can't be read or parsed
     */
    public static MuxOptionsConfig load(File file) throws IOException {
        return SerializationUtils.fromYamlFile(file, MuxOptionsConfig.class);
    }

    /**
     * Loads the rules bundled with this package.
     *
     * @throws IOException if the resource is missing or can't be parsed
     */
    public static MuxOptionsConfig loadDefault() throws IOException {
        try (InputStream stream = MuxOptionsConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (stream == null) {
                throw new IOException("Missing classpath resource: " + DEFAULT_RESOURCE);
            }
            return SerializationUtils.fromYamlStream(stream, MuxOptionsConfig.class);
        }
    }

    @JsonProperty("mux-sensitive-options")
    public List<Rule> getRules() {
        return rules;
    }

    /**
     * Returns whether the provided option affects which bricks may share a process.
     */
    public boolean isMuxSensitive(String optionName) {
        for (Rule rule : rules) {
            if (rule.matches(optionName)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the default value of the provided option, if any rule declares one. Exact rules take precedence over
     * prefix rules.
     */
    public Optional<String> getDefault(String optionName) {
        Optional<String> prefixDefault = Optional.empty();
        for (Rule rule : rules) {
            if (!rule.matches(optionName) || rule.getDefaultValue() == null) {
                continue;
            }
            if (!rule.isPrefix()) {
                return Optional.of(rule.getDefaultValue());
            }
            if (!prefixDefault.isPresent()) {
                prefixDefault = Optional.of(rule.getDefaultValue());
            }
        }
        return prefixDefault;
    }

    /**
     * A single mux-sensitive option name or prefix.
     */
    public static final class Rule {
        private final String name;
        private final String defaultValue;

        @JsonCreator
        public Rule(
                @JsonProperty("name") String name,
                @JsonProperty("default") String defaultValue) {
            if (StringUtils.isBlank(name)) {
                throw new IllegalArgumentException("Mux-sensitive option rules require a name");
            }
            this.name = name.trim();
            this.defaultValue = defaultValue;
        }

        @JsonProperty("name")
        public String getName() {
            return name;
        }

        @JsonProperty("default")
        public String getDefaultValue() {
            return defaultValue;
        }

        boolean isPrefix() {
            return name.endsWith(PREFIX_SUFFIX);
        }

        boolean matches(String optionName) {
            if (isPrefix()) {
                // "io-threads.*" matches "io-threads.thread-count"
                String prefix = name.substring(0, name.length() - 1);
                return optionName.startsWith(prefix) && optionName.length() > prefix.length();
            }
            return name.equals(optionName);
        }

        @Override
        public String toString() {
            return defaultValue == null ? name : String.format("%s (default %s)", name, defaultValue);
        }
    }
}
