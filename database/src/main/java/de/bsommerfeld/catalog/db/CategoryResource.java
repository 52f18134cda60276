package de.bsommerfeld.catalog.db;

import java.util.List;

/**
 * Prefix queries against the persisted category paths.
 */
public interface CategoryResource {

    /**
     * Returns the ids of every category whose path equals {@code prefix} or
     * starts with {@code prefix + "/"}. Matching happens on whole path segments,
     * so {@code "1/2"} matches {@code "1/2/5"} but never {@code "1/20"}.
     *
     * <p>
     * Ids come back in the order the store yields them; callers must not rely
     * on any particular sort.
     *
     * @throws CategoryQueryException if the store cannot be read
     */
    List<Integer> findIdsByPathPrefix(String prefix);
}
