package io.brickmux.brick;

import io.brickmux.storage.PersisterUtils;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.util.Comparator;

/**
 * Identifies a brick: the volume it belongs to, the peer hosting it, and its path on that peer.
 */
public final class BrickId implements Comparable<BrickId> {

    private static final Comparator<BrickId> ORDERING = Comparator
            .comparing(BrickId::getVolume)
            .thenComparing(BrickId::getPeer)
            .thenComparing(BrickId::getPath);

    private final String volume;
    private final String peer;
    private final String path;

    @JsonCreator
    public BrickId(
            @JsonProperty("volume") String volume,
            @JsonProperty("peer") String peer,
            @JsonProperty("path") String path) {
        if (StringUtils.isBlank(volume) || StringUtils.isBlank(peer) || StringUtils.isBlank(path)) {
            throw new IllegalArgumentException(String.format(
                    "Brick volume, peer and path must all be non-empty: volume=%s peer=%s path=%s",
                    volume, peer, path));
        }
        if (volume.contains(PersisterUtils.PATH_DELIM_STR)) {
            throw new IllegalArgumentException("Volume names may not contain slashes: " + volume);
        }
        this.volume = volume;
        this.peer = peer;
        this.path = path;
    }

    @JsonProperty("volume")
    public String getVolume() {
        return volume;
    }

    @JsonProperty("peer")
    public String getPeer() {
        return peer;
    }

    @JsonProperty("path")
    public String getPath() {
        return path;
    }

    /**
     * Returns the brick's name within its volume, in the form {@code peer:path}.
     */
    @JsonIgnore
    public String getName() {
        return peer + ":" + path;
    }

    /**
     * Returns a name for this brick which may be used as a single storage node name.
     */
    @JsonIgnore
    public String getStorageName() {
        return PersisterUtils.withEscapedSlashes(getName());
    }

    @Override
    public int compareTo(BrickId other) {
        return ORDERING.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        return EqualsBuilder.reflectionEquals(this, o);
    }

    @Override
    public int hashCode() {
        return HashCodeBuilder.reflectionHashCode(this);
    }

    @Override
    public String toString() {
        return String.format("%s[%s]", volume, getName());
    }
}
