package de.bsommerfeld.catalog.urlrewrite.map;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.catalog.core.domain.Category;
import de.bsommerfeld.catalog.core.event.ApplicationEventBus;
import de.bsommerfeld.catalog.core.event.CategoryEvents.CategorySubtreeRemovedEvent;
import de.bsommerfeld.catalog.core.event.CategoryEvents.CategoryTreeChangedEvent;
import de.bsommerfeld.catalog.core.event.CategoryEvents.CategoryTreeReloadedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Keeps {@link DataCategoryHashMap} consistent with tree writes.
 *
 * <p>
 * Creating, updating or moving category C can alter the descendant list of C
 * and of every ancestor of C. All of those ids are on C's path, so the
 * invalidator resets exactly the ids encoded in the event's path. A move is
 * announced once per path.
 *
 * <p>
 * Deleting C additionally removes every descendant of C. Their entries would
 * otherwise keep answering for categories that no longer exist, so the ids
 * carried by the removal event are reset too. Entries of unrelated branches
 * survive in both cases.
 */
@Singleton
public class CategoryMapInvalidator {

    private static final Logger LOG = LoggerFactory.getLogger(CategoryMapInvalidator.class);

    private final DataCategoryHashMap hashMap;

    @Inject
    public CategoryMapInvalidator(ApplicationEventBus eventBus, DataCategoryHashMap hashMap) {
        this.hashMap = hashMap;
        eventBus.register(this);
    }

    @Subscribe
    public void onCategoryTreeChanged(CategoryTreeChangedEvent event) {
        if (resetPath(event.categoryId(), event.path())) {
            LOG.debug("Invalidated entries on {} for change of category {}", event.path(), event.categoryId());
        }
    }

    @Subscribe
    public void onCategorySubtreeRemoved(CategorySubtreeRemovedEvent event) {
        if (!resetPath(event.categoryId(), event.path()))
            return;
        for (Integer id : event.removedIds()) {
            hashMap.resetData(id);
        }
        LOG.debug("Invalidated {} removed categories below {}", event.removedIds().size(), event.path());
    }

    @Subscribe
    public void onCategoryTreeReloaded(CategoryTreeReloadedEvent event) {
        hashMap.resetAll();
    }

    /**
     * Resets the ids encoded in {@code path}. An unparseable path clears the
     * whole map instead.
     *
     * @return {@code false} if the whole map was cleared
     */
    private boolean resetPath(int categoryId, String path) {
        List<Integer> affected;
        try {
            affected = Category.idsOnPath(path);
        } catch (IllegalArgumentException e) {
            LOG.warn("Unparseable path '{}' for category {}, clearing all entries.", path, categoryId);
            hashMap.resetAll();
            return false;
        }
        for (Integer id : affected) {
            hashMap.resetData(id);
        }
        return true;
    }
}
