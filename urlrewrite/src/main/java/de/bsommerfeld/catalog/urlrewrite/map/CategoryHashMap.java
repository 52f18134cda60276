package de.bsommerfeld.catalog.urlrewrite.map;

import java.util.List;

/**
 * Memoized per-category data derived from the category tree.
 */
public interface CategoryHashMap {

    /**
     * Returns all data held for the category, computing it on first access.
     */
    List<Integer> getAllData(int categoryId);

    /**
     * Returns the data stored under {@code key} for the category, or an empty
     * list if there is none.
     */
    List<Integer> getData(int categoryId, int key);

    /**
     * Drops whatever is held for the category. A no-op if nothing is held.
     */
    void resetData(int categoryId);
}
