package de.bsommerfeld.catalog.db;

import de.bsommerfeld.catalog.core.domain.Category;

/**
 * Resolves a single category by id.
 */
public interface CategoryRepository {

    /**
     * @throws CategoryNotFoundException if no category has this id
     * @throws CategoryQueryException    if the store cannot be read
     */
    Category get(int categoryId);
}
