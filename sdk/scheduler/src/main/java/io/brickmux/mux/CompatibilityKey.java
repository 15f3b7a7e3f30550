package io.brickmux.mux;

import io.brickmux.brick.BrickId;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.hash.Hashing;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Identifies a group of bricks which may share one brick-server process. Two bricks may share a process if and only
 * if their keys are equal. Keys are always recomputed from brick options and never stored.
 */
public final class CompatibilityKey {

    private static final int DIGEST_LENGTH = 12;

    private final ImmutableSortedMap<String, String> options;
    private final Optional<BrickId> standaloneBrick;
    private final String digest;

    private CompatibilityKey(Map<String, String> options, Optional<BrickId> standaloneBrick) {
        this.options = ImmutableSortedMap.copyOf(options);
        this.standaloneBrick = standaloneBrick;
        this.digest = Hashing.sha256()
                .hashString(getCanonicalString(), StandardCharsets.UTF_8)
                .toString()
                .substring(0, DIGEST_LENGTH);
    }

    /**
     * Returns a key shared by all bricks with the provided normalized mux-sensitive options.
     */
    public static CompatibilityKey shared(Map<String, String> normalizedOptions) {
        return new CompatibilityKey(normalizedOptions, Optional.empty());
    }

    /**
     * Returns a key which only the provided brick has, used when multiplexing is disabled.
     */
    public static CompatibilityKey standalone(BrickId brick) {
        return new CompatibilityKey(ImmutableSortedMap.of(), Optional.of(brick));
    }

    public Map<String, String> getOptions() {
        return options;
    }

    public boolean isStandalone() {
        return standaloneBrick.isPresent();
    }

    /**
     * Returns a short digest of this key, for logs and process naming.
     */
    public String getDigest() {
        return digest;
    }

    private String getCanonicalString() {
        String optionsStr = Joiner.on(';').withKeyValueSeparator('=').join(options);
        return standaloneBrick.isPresent()
                ? String.format("standalone:%s:%s", standaloneBrick.get().getVolume(), standaloneBrick.get().getName())
                : "shared:" + optionsStr;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CompatibilityKey other = (CompatibilityKey) o;
        return new EqualsBuilder()
                .append(options, other.options)
                .append(standaloneBrick, other.standaloneBrick)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder()
                .append(options)
                .append(standaloneBrick)
                .toHashCode();
    }

    @Override
    public String toString() {
        return isStandalone()
                ? String.format("key[%s standalone %s]", digest, standaloneBrick.get())
                : String.format("key[%s %s]", digest, options);
    }
}
