package de.bsommerfeld.catalog.urlrewrite.map;

import de.bsommerfeld.catalog.core.domain.Category;
import de.bsommerfeld.catalog.db.CategoryNotFoundException;
import de.bsommerfeld.catalog.db.CategoryQueryException;
import de.bsommerfeld.catalog.db.CategoryRepository;
import de.bsommerfeld.catalog.db.CategoryResource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests the memoization contract of DataCategoryHashMap. Both collaborators
 * are mocked to count queries.
 */
@ExtendWith(MockitoExtension.class)
class DataCategoryHashMapTest {

    @Mock
    private CategoryRepository categoryRepository;

    @Mock
    private CategoryResource categoryResource;

    private DataCategoryHashMap hashMap;

    @BeforeEach
    void setUp() {
        hashMap = new DataCategoryHashMap(categoryRepository, categoryResource);
    }

    // -- getAllData --

    @Test
    void getAllData_shouldReturnSelfAndDescendants() {
        stubCategory(2, "1/2", List.of(2, 5, 6));

        List<Integer> ids = hashMap.getAllData(2);

        assertEquals(3, ids.size());
        assertTrue(ids.containsAll(List.of(2, 5, 6)));
        verify(categoryResource).findIdsByPathPrefix("1/2");
    }

    @Test
    void getAllData_shouldKeepStoreOrder() {
        stubCategory(2, "1/2", List.of(6, 2, 5));
        assertEquals(List.of(6, 2, 5), hashMap.getAllData(2));
    }

    @Test
    void getAllData_shouldQueryOnlyOncePerId() {
        stubCategory(2, "1/2", List.of(2, 5));

        List<Integer> first = hashMap.getAllData(2);
        List<Integer> second = hashMap.getAllData(2);

        assertSame(first, second);
        verify(categoryRepository, times(1)).get(2);
        verify(categoryResource, times(1)).findIdsByPathPrefix("1/2");
    }

    @Test
    void getAllData_shouldReturnImmutableList() {
        stubCategory(2, "1/2", List.of(2, 5));
        assertThrows(UnsupportedOperationException.class, () -> hashMap.getAllData(2).add(99));
    }

    @Test
    void getAllData_shouldPropagateNotFoundAndLeaveNoEntry() {
        when(categoryRepository.get(404)).thenThrow(new CategoryNotFoundException(404));

        assertThrows(CategoryNotFoundException.class, () -> hashMap.getAllData(404));

        assertFalse(hashMap.isCached(404));
        assertEquals(0, hashMap.size());
        verifyNoInteractions(categoryResource);
    }

    @Test
    void getAllData_shouldPropagateQueryErrorAndRetryNextTime() {
        when(categoryRepository.get(2)).thenReturn(new Category(2, 1, "1/2", 0, 1, "Default"));
        when(categoryResource.findIdsByPathPrefix("1/2"))
                .thenThrow(new CategoryQueryException("disk on fire"))
                .thenReturn(List.of(2, 5));

        assertThrows(CategoryQueryException.class, () -> hashMap.getAllData(2));
        assertFalse(hashMap.isCached(2));

        assertEquals(List.of(2, 5), hashMap.getAllData(2));
        verify(categoryResource, times(2)).findIdsByPathPrefix("1/2");
    }

    // -- resetData --

    @Test
    void resetData_shouldForceFreshQuery() {
        stubCategory(2, "1/2", List.of(2, 5));

        hashMap.getAllData(2);
        hashMap.resetData(2);
        hashMap.getAllData(2);

        verify(categoryResource, times(2)).findIdsByPathPrefix("1/2");
    }

    @Test
    void resetData_shouldNotTouchOtherEntries() {
        stubCategory(2, "1/2", List.of(2, 5));
        stubCategory(3, "1/3", List.of(3));

        hashMap.getAllData(2);
        hashMap.getAllData(3);
        hashMap.resetData(2);

        assertFalse(hashMap.isCached(2));
        assertTrue(hashMap.isCached(3));
    }

    @Test
    void resetData_shouldBeIdempotentForUnknownId() {
        assertDoesNotThrow(() -> hashMap.resetData(77));
        assertDoesNotThrow(() -> hashMap.resetData(77));
    }

    @Test
    void resetAll_shouldDropEveryEntry() {
        stubCategory(2, "1/2", List.of(2));
        stubCategory(3, "1/3", List.of(3));
        hashMap.getAllData(2);
        hashMap.getAllData(3);

        hashMap.resetAll();

        assertEquals(0, hashMap.size());
    }

    // -- getData --

    @Test
    void getData_shouldReturnEmptyForAbsentKey() {
        stubCategory(2, "1/2", List.of(2, 5));

        assertTrue(hashMap.getData(2, 7).isEmpty());
        assertTrue(hashMap.getData(2, -1).isEmpty());
    }

    @Test
    void getData_shouldReturnCachedListForPopulatedSlot() {
        stubCategory(2, "1/2", List.of(2, 5));
        assertEquals(List.of(2, 5), hashMap.getData(2, 1));
    }

    @Test
    void getData_shouldShareTheCachedEntry() {
        stubCategory(2, "1/2", List.of(2, 5));

        hashMap.getData(2, 0);
        hashMap.getAllData(2);

        verify(categoryResource, times(1)).findIdsByPathPrefix("1/2");
    }

    @Test
    void getData_shouldPropagateNotFound() {
        when(categoryRepository.get(404)).thenThrow(new CategoryNotFoundException(404));
        assertThrows(CategoryNotFoundException.class, () -> hashMap.getData(404, 0));
    }

    // -- Warmup --

    @Test
    void warmup_shouldCacheResolvableIdsAndSkipUnknown() {
        stubCategory(2, "1/2", List.of(2, 5));
        when(categoryRepository.get(404)).thenThrow(new CategoryNotFoundException(404));

        int warmed = hashMap.warmup(List.of(2, 404));

        assertEquals(1, warmed);
        assertTrue(hashMap.isCached(2));
        assertFalse(hashMap.isCached(404));
    }

    @Test
    void warmup_shouldAcceptEmptyInput() {
        assertEquals(0, hashMap.warmup(List.of()));
        assertEquals(0, hashMap.warmup(null));
    }

    // -- Helpers --

    private void stubCategory(int id, String path, List<Integer> subtree) {
        when(categoryRepository.get(id)).thenReturn(new Category(id, 1, path, 0, 1, "c" + id));
        when(categoryResource.findIdsByPathPrefix(path)).thenReturn(subtree);
    }
}
