package de.bsommerfeld.catalog.urlrewrite.tree;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.catalog.core.domain.Category;
import de.bsommerfeld.catalog.core.event.ApplicationEventBus;
import de.bsommerfeld.catalog.core.event.CategoryEvents.CategorySubtreeRemovedEvent;
import de.bsommerfeld.catalog.core.event.CategoryEvents.CategoryTreeChangedEvent;
import de.bsommerfeld.catalog.core.event.CategoryEvents.CategoryTreeReloadedEvent;
import de.bsommerfeld.catalog.db.CategoryDatabaseService;
import de.bsommerfeld.catalog.db.CategoryNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Write entry point for the category tree. Persists through
 * {@link CategoryDatabaseService} and announces every change on the
 * {@link ApplicationEventBus} so derived caches can drop stale entries.
 *
 * <p>
 * Events are posted only after the store accepted the write. If the store
 * throws, nothing is posted and the exception reaches the caller.
 */
@Singleton
public class CategoryTreeWriter {

    private static final Logger LOG = LoggerFactory.getLogger(CategoryTreeWriter.class);

    private final CategoryDatabaseService databaseService;
    private final ApplicationEventBus eventBus;

    @Inject
    public CategoryTreeWriter(CategoryDatabaseService databaseService, ApplicationEventBus eventBus) {
        this.databaseService = databaseService;
        this.eventBus = eventBus;
    }

    /**
     * Creates or updates a category. When the path changed (a move), the store
     * carries the subtree along and both the old and the new branch are
     * announced.
     */
    public void save(Category category) {
        String previousPath = findPath(category.id());
        databaseService.saveCategory(category);

        if (previousPath != null && !previousPath.equals(category.path())) {
            LOG.info("Category {} moved from {} to {}", category.id(), previousPath, category.path());
            eventBus.post(new CategoryTreeChangedEvent(category.id(), previousPath));
        }
        eventBus.post(new CategoryTreeChangedEvent(category.id(), category.path()));
    }

    /**
     * Writes many categories in one transaction and announces a full reload.
     */
    public void saveAll(List<Category> categories) {
        if (categories == null || categories.isEmpty())
            return;
        databaseService.saveCategoriesBatch(categories);
        eventBus.post(new CategoryTreeReloadedEvent());
    }

    /**
     * Deletes the category with its subtree. The removed ids are collected
     * before the delete so every one of them can be dropped from derived caches.
     *
     * @return number of categories removed
     */
    public int delete(int categoryId) {
        String path = findPath(categoryId);
        if (path == null)
            return 0;

        List<Integer> subtree = databaseService.findIdsByPathPrefix(path);
        int deleted = databaseService.deleteCategoryTree(categoryId);
        eventBus.post(new CategorySubtreeRemovedEvent(categoryId, path, subtree));
        return deleted;
    }

    private String findPath(int categoryId) {
        try {
            return databaseService.get(categoryId).path();
        } catch (CategoryNotFoundException e) {
            return null;
        }
    }
}
