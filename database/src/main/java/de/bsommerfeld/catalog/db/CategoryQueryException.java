package de.bsommerfeld.catalog.db;

/**
 * Thrown when the underlying store fails to execute a category query or write.
 * Usually wraps a {@link java.sql.SQLException}.
 */
public class CategoryQueryException extends RuntimeException {

    public CategoryQueryException(String message) {
        super(message);
    }

    public CategoryQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
