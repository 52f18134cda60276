package de.bsommerfeld.catalog.core.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CategoryTest {

    @Test
    void childOf_shouldExtendParentPathAndLevel() {
        Category root = Category.root(1, "Root");
        Category child = Category.childOf(root, 2, "Default", 1);
        Category grandChild = Category.childOf(child, 5, "Gear", 3);

        assertEquals("1/2/5", grandChild.path());
        assertEquals(2, grandChild.level());
        assertEquals(2, grandChild.parentId());
        assertEquals(3, grandChild.position());
    }

    @Test
    void ancestorIds_shouldListRootFirstAndSelfLast() {
        Category category = new Category(5, 2, "1/2/5", 0, 2, "Gear");
        assertEquals(List.of(1, 2, 5), category.ancestorIds());
    }

    @Test
    void isDescendantOf_shouldRespectSegmentBoundaries() {
        Category category = new Category(20, 1, "1/20", 0, 1, null);

        assertTrue(category.isDescendantOf("1"));
        assertFalse(category.isDescendantOf("1/2"));
        assertFalse(category.isDescendantOf("1/20"), "A category is not its own descendant");
    }

    @Test
    void constructor_shouldRejectBlankPath() {
        assertThrows(IllegalArgumentException.class, () -> new Category(1, 0, " ", 0, 0, "x"));
        assertThrows(IllegalArgumentException.class, () -> new Category(1, 0, null, 0, 0, "x"));
    }

    @Test
    void idsOnPath_shouldRejectNonNumericSegments() {
        assertThrows(IllegalArgumentException.class, () -> Category.idsOnPath("1/abc/3"));
    }
}
