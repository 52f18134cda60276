package de.bsommerfeld.catalog.db;

/**
 * Thrown when a category id does not exist in the store.
 */
public class CategoryNotFoundException extends RuntimeException {

    private final int categoryId;

    public CategoryNotFoundException(int categoryId) {
        super("No such category: " + categoryId);
        this.categoryId = categoryId;
    }

    public int getCategoryId() {
        return categoryId;
    }
}
