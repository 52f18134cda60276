package de.bsommerfeld.catalog.urlrewrite.map;

import de.bsommerfeld.catalog.core.domain.Category;
import de.bsommerfeld.catalog.core.event.ApplicationEventBus;
import de.bsommerfeld.catalog.core.event.CategoryEvents.CategorySubtreeRemovedEvent;
import de.bsommerfeld.catalog.core.event.CategoryEvents.CategoryTreeChangedEvent;
import de.bsommerfeld.catalog.core.event.CategoryEvents.CategoryTreeReloadedEvent;
import de.bsommerfeld.catalog.db.TestCategoryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CategoryMapInvalidatorTest {

    private ApplicationEventBus eventBus;
    private DataCategoryHashMap hashMap;

    @BeforeEach
    void setUp() {
        Category root = Category.root(1, "Root");
        Category a = Category.childOf(root, 2, "A", 1);
        Category b = Category.childOf(root, 3, "B", 2);
        Category aa = Category.childOf(a, 5, "AA", 1);
        TestCategoryService store = new TestCategoryService(List.of(root, a, b, aa));

        eventBus = new ApplicationEventBus();
        hashMap = new DataCategoryHashMap(store, store);
        new CategoryMapInvalidator(eventBus, hashMap);

        hashMap.warmup(List.of(1, 2, 3, 5));
    }

    @Test
    void treeChange_shouldResetCategoryAndAncestors() {
        eventBus.post(new CategoryTreeChangedEvent(5, "1/2/5"));

        assertFalse(hashMap.isCached(1));
        assertFalse(hashMap.isCached(2));
        assertFalse(hashMap.isCached(5));
    }

    @Test
    void treeChange_shouldKeepUnrelatedBranches() {
        eventBus.post(new CategoryTreeChangedEvent(5, "1/2/5"));
        assertTrue(hashMap.isCached(3));
    }

    @Test
    void treeChange_withMalformedPath_shouldClearEverything() {
        eventBus.post(new CategoryTreeChangedEvent(5, "not/a/path"));
        assertEquals(0, hashMap.size());
    }

    @Test
    void treeReload_shouldClearEverything() {
        eventBus.post(new CategoryTreeReloadedEvent());
        assertEquals(0, hashMap.size());
    }

    @Test
    void subtreeRemoval_shouldResetAncestorsAndRemovedIds() {
        eventBus.post(new CategorySubtreeRemovedEvent(2, "1/2", List.of(2, 5)));

        assertFalse(hashMap.isCached(1));
        assertFalse(hashMap.isCached(2));
        assertFalse(hashMap.isCached(5));
        assertTrue(hashMap.isCached(3));
    }
}
