package de.bsommerfeld.catalog.db;

import de.bsommerfeld.catalog.core.domain.Category;

import java.util.List;

/**
 * Persistence contract for the category tree. Implementations must be
 * thread-safe.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link SqlCategoryService} for production persistence via SQLite</li>
 * <li>{@link TestCategoryService} as an in-memory store for TEST mode,
 * pre-seeded with a generated tree, no disk I/O</li>
 * </ul>
 *
 * Switching between them is done at the Guice module level. Read-only
 * consumers should depend on {@link CategoryRepository} or
 * {@link CategoryResource} instead of this interface.
 */
public interface CategoryDatabaseService extends CategoryRepository, CategoryResource {

    /**
     * Inserts the category or, if the id already exists, overwrites parent,
     * path, position, level and name.
     *
     * <p>
     * If the path changed, the category moved: every descendant gets the new
     * path prefix and its level shifted by the same amount, atomically with the
     * category itself.
     *
     * @throws IllegalArgumentException if the new path lies below the old one
     */
    void saveCategory(Category category);

    /**
     * Same semantics as {@link #saveCategory} for each entry, executed as one
     * transaction.
     */
    void saveCategoriesBatch(List<Category> categories);

    /**
     * Deletes the category and every descendant.
     *
     * @return number of categories removed, {@code 0} if the id was unknown
     */
    int deleteCategoryTree(int categoryId);

    /**
     * Returns every stored category ordered by path.
     */
    List<Category> getAllCategories();
}
