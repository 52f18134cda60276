package de.bsommerfeld.catalog.urlrewrite.map;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.catalog.core.domain.Category;
import de.bsommerfeld.catalog.db.CategoryNotFoundException;
import de.bsommerfeld.catalog.db.CategoryQueryException;
import de.bsommerfeld.catalog.db.CategoryRepository;
import de.bsommerfeld.catalog.db.CategoryResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds, per category id, the ids of that category and all of its
 * subcategories.
 *
 * <p>
 * An entry is computed on the first {@link #getAllData} call for an id: the
 * category's path is resolved through the {@link CategoryRepository}, then the
 * {@link CategoryResource} is asked for every id under that path. The category
 * itself is part of the result since its own path matches. The list is kept in
 * the order the store returned it and is never recomputed until
 * {@link #resetData} removes it.
 *
 * <h3>Failures</h3>
 * {@link CategoryNotFoundException} and {@link CategoryQueryException}
 * propagate unchanged. A failed computation leaves no entry behind, so the next
 * call tries again.
 *
 * <h3>Threading</h3>
 * Entries are computed inside {@link ConcurrentHashMap#computeIfAbsent}: two
 * threads asking for the same uncached id trigger one query, the second
 * waits for the first. Other ids are not blocked.
 */
@Singleton
public class DataCategoryHashMap implements CategoryHashMap {

    private static final Logger LOG = LoggerFactory.getLogger(DataCategoryHashMap.class);

    private final CategoryRepository categoryRepository;
    private final CategoryResource categoryResource;

    private final Map<Integer, List<Integer>> hashMap = new ConcurrentHashMap<>();

    @Inject
    public DataCategoryHashMap(CategoryRepository categoryRepository, CategoryResource categoryResource) {
        this.categoryRepository = categoryRepository;
        this.categoryResource = categoryResource;
    }

    /**
     * Returns the ids of the category and all of its subcategories.
     *
     * @throws CategoryNotFoundException if the category does not exist
     * @throws CategoryQueryException    if the descendant query fails
     */
    @Override
    public List<Integer> getAllData(int categoryId) {
        return hashMap.computeIfAbsent(categoryId, this::getAllCategoryChildrenIds);
    }

    /**
     * Entries are flat id lists, so {@code key} addresses a slot in that list.
     * If the slot is populated the whole descendant list is returned, otherwise
     * an empty list.
     */
    @Override
    public List<Integer> getData(int categoryId, int key) {
        List<Integer> categorySpecificData = getAllData(categoryId);
        if (key >= 0 && key < categorySpecificData.size()) {
            return categorySpecificData;
        }
        return List.of();
    }

    @Override
    public void resetData(int categoryId) {
        if (hashMap.remove(categoryId) != null) {
            LOG.debug("Reset descendant ids of category {}", categoryId);
        }
    }

    /**
     * Drops every entry. Used after bulk tree rewrites where tracking the
     * affected ids is not worth it.
     */
    public void resetAll() {
        int size = hashMap.size();
        hashMap.clear();
        LOG.info("Cleared descendant ids of {} categories.", size);
    }

    /**
     * Computes entries for the given ids up front. Ids that cannot be resolved
     * are logged and skipped; they leave no entry.
     *
     * @return number of ids now cached
     */
    public int warmup(Collection<Integer> categoryIds) {
        if (categoryIds == null || categoryIds.isEmpty())
            return 0;

        LOG.info("Warming up category hash map for {} categories...", categoryIds.size());
        int warmed = 0;
        for (Integer id : categoryIds) {
            try {
                getAllData(id);
                warmed++;
            } catch (CategoryNotFoundException | CategoryQueryException e) {
                LOG.warn("Skipping warmup of category {}: {}", id, e.getMessage());
            }
        }
        LOG.info("Category hash map warmed with {} categories.", warmed);
        return warmed;
    }

    public boolean isCached(int categoryId) {
        return hashMap.containsKey(categoryId);
    }

    public int size() {
        return hashMap.size();
    }

    private List<Integer> getAllCategoryChildrenIds(int categoryId) {
        Category category = categoryRepository.get(categoryId);
        List<Integer> ids = List.copyOf(categoryResource.findIdsByPathPrefix(category.path()));
        LOG.debug("Computed {} descendant ids for category {} ({})", ids.size(), categoryId, category.path());
        return ids;
    }
}
