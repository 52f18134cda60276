package de.bsommerfeld.catalog.db;

import com.google.inject.Singleton;
import de.bsommerfeld.catalog.core.domain.Category;
import de.bsommerfeld.catalog.core.util.CategoryTreeGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link CategoryDatabaseService} for TEST mode. No disk I/O, no
 * SQLite, no schema. Bound by Guice when the application runs with
 * {@code app.mode=TEST}.
 *
 * <p>
 * The default constructor pre-seeds the store with a generated tree four
 * levels below the default category (see {@link CategoryTreeGenerator}), so
 * descendant lookups return populated lists right away. Subtree matching
 * follows the same segment-boundary rule as {@link SqlCategoryService}.
 */
@Singleton
public class TestCategoryService implements CategoryDatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(TestCategoryService.class);

    private final Map<Integer, Category> memoryStore = new ConcurrentHashMap<>();

    public TestCategoryService() {
        this(CategoryTreeGenerator.generateTree(4, 3, 20170101L));
    }

    public TestCategoryService(List<Category> seed) {
        LOG.warn("#########################################################");
        LOG.warn("#  TEST MODE ENABLED: Category persistence is DISABLED  #");
        LOG.warn("#########################################################");
        for (Category c : seed) {
            memoryStore.put(c.id(), c);
        }
        LOG.info("Seeded in-memory category store with {} categories.", memoryStore.size());
    }

    @Override
    public Category get(int categoryId) {
        Category category = memoryStore.get(categoryId);
        if (category == null) {
            throw new CategoryNotFoundException(categoryId);
        }
        return category;
    }

    @Override
    public List<Integer> findIdsByPathPrefix(String prefix) {
        List<Integer> ids = new ArrayList<>();
        for (Category c : memoryStore.values()) {
            if (c.path().equals(prefix) || c.isDescendantOf(prefix)) {
                ids.add(c.id());
            }
        }
        return ids;
    }

    @Override
    public synchronized void saveCategory(Category category) {
        Category previous = memoryStore.get(category.id());
        if (previous != null && !previous.path().equals(category.path())) {
            if (category.isDescendantOf(previous.path())) {
                throw new IllegalArgumentException("Category " + category.id() + " cannot move below itself: "
                        + previous.path() + " -> " + category.path());
            }
            int levelDelta = category.level() - previous.level();
            for (Category c : List.copyOf(memoryStore.values())) {
                if (c.isDescendantOf(previous.path())) {
                    String movedPath = category.path() + c.path().substring(previous.path().length());
                    memoryStore.put(c.id(), new Category(c.id(), c.parentId(), movedPath, c.position(),
                            c.level() + levelDelta, c.name()));
                }
            }
        }
        memoryStore.put(category.id(), category);
    }

    @Override
    public synchronized void saveCategoriesBatch(List<Category> categories) {
        if (categories == null)
            return;
        categories.forEach(this::saveCategory);
    }

    @Override
    public synchronized int deleteCategoryTree(int categoryId) {
        Category root = memoryStore.get(categoryId);
        if (root == null)
            return 0;

        int deleted = 0;
        for (Integer id : findIdsByPathPrefix(root.path())) {
            if (memoryStore.remove(id) != null)
                deleted++;
        }
        return deleted;
    }

    @Override
    public List<Category> getAllCategories() {
        List<Category> all = new ArrayList<>(memoryStore.values());
        all.sort(Comparator.comparing(Category::path));
        return all;
    }
}
