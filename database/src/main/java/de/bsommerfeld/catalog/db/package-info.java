/**
 * Persistence layer for the category tree. SQLite-backed in production,
 * in-memory in TEST mode.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [DataCategoryHashMap]          [CategoryTreeWriter]
 *      │              │                    │
 *      ▼              ▼                    ▼
 *   CategoryRepository  CategoryResource   CategoryDatabaseService
 *   (get by id)         (prefix query)     (read + write)
 *            └──────────────┴──────────┬───────┘
 *                                      ▼
 *                      ┌───────────────┴───────────────┐
 *                      │                               │
 *              SqlCategoryService             TestCategoryService
 * </pre>
 *
 * <h2>Database Schema</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ catalog_category_entity                                          │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ entity_id (PK)   │ Category id                                   │
 * │ parent_id        │ Parent id, 0 for a tree root                  │
 * │ path             │ Materialized path, e.g. "1/2/5" (indexed)     │
 * │ position         │ Sort order among siblings                     │
 * │ level            │ Depth, roots are 0                            │
 * │ name             │ Display name                                  │
 * └──────────────────┴────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>SQL File Inventory</h2>
 * Loaded via {@link de.bsommerfeld.catalog.db.SqlLoader} from {@code sql/}:
 * <ul>
 * <li>{@code upsert-category.sql}: INSERT or UPDATE one category</li>
 * <li>{@code select-category.sql}: single category by id</li>
 * <li>{@code select-all-categories.sql}: whole tree ordered by path</li>
 * <li>{@code select-ids-by-path-prefix.sql}: subtree ids for a path</li>
 * <li>{@code delete-category-tree.sql}: delete a subtree by path</li>
 * </ul>
 */
package de.bsommerfeld.catalog.db;
