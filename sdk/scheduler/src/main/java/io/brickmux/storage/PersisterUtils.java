package io.brickmux.storage;

import io.brickmux.storage.StorageError.Reason;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Path handling shared by the {@link Persister} implementations and the stores built on them.
 */
public final class PersisterUtils {

    public static final char PATH_DELIM = '/';
    public static final String PATH_DELIM_STR = String.valueOf(PATH_DELIM);

    // brick paths are flattened into one node name, so this sequence may not appear in them
    private static final String SLASH_REPLACEMENT = "__";

    private static final Splitter NAME_SPLITTER = Splitter.on(PATH_DELIM).omitEmptyStrings();
    private static final Joiner NAME_JOINER = Joiner.on(PATH_DELIM);

    private PersisterUtils() {
        // do not instantiate
    }

    /**
     * Flattens a brick location such as {@code peer-1:/bricks/b1} into the single node name
     * {@code peer-1:__bricks__b1}. A leading slash is dropped, as in {@code /storage/east} => {@code storage__east}.
     *
     * @throws IllegalArgumentException if the name already contains {@code __}
     */
    public static String withEscapedSlashes(String name) {
        if (name.contains(SLASH_REPLACEMENT)) {
            throw new IllegalArgumentException("Names may not contain double underscores: " + name);
        }
        String trimmed = name.startsWith(PATH_DELIM_STR) ? name.substring(1) : name;
        return trimmed.replace(PATH_DELIM_STR, SLASH_REPLACEMENT);
    }

    /**
     * Returns the children of {@code path}, or an empty collection if nothing was ever stored there.
     */
    public static Collection<String> getChildrenOrEmpty(Persister persister, String path) throws PersisterException {
        try {
            return persister.getChildren(path);
        } catch (PersisterException e) {
            if (e.getReason() == Reason.NOT_FOUND) {
                return Collections.emptySet();
            }
            throw e;
        }
    }

    /**
     * Joins path elements with single delimiters. The result is absolute only if the first element is.
     *
     * <p>{@code ("/brickmux-c1/", "/Volumes", "v1")} => {@code "/brickmux-c1/Volumes/v1"}
     */
    public static String joinPaths(String... elements) {
        List<String> names = new ArrayList<>();
        for (String element : elements) {
            names.addAll(NAME_SPLITTER.splitToList(element));
        }
        String joined = NAME_JOINER.join(names);
        return elements.length > 0 && elements[0].startsWith(PATH_DELIM_STR) ? PATH_DELIM + joined : joined;
    }

    /**
     * Returns every proper ancestor of {@code path}, outermost first, keeping a leading slash if present.
     *
     * <p>{@code "/brickmux-c1/Volumes/v1"} => {@code ["/brickmux-c1", "/brickmux-c1/Volumes"]}
     */
    public static List<String> getParentPaths(String path) {
        String prefix = path.startsWith(PATH_DELIM_STR) ? PATH_DELIM_STR : "";
        List<String> names = NAME_SPLITTER.splitToList(path);
        List<String> parents = new ArrayList<>();
        for (int i = 1; i < names.size(); ++i) {
            parents.add(prefix + NAME_JOINER.join(names.subList(0, i)));
        }
        return parents;
    }
}
