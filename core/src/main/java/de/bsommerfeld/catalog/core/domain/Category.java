package de.bsommerfeld.catalog.core.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable snapshot of a catalog category node.
 *
 * <p>
 * The {@code path} encodes the full ancestry as ids joined by
 * {@link #PATH_SEPARATOR}, ending in the category's own id. A root category
 * with id 1 has path {@code "1"}, its child 2 has {@code "1/2"}, and a
 * grandchild 5 has {@code "1/2/5"}. Every descendant's path therefore starts
 * with the ancestor's path followed by the separator, which is what the
 * descendant lookup relies on.
 *
 * @param id       unique category id
 * @param parentId id of the parent category, {@code 0} for a tree root
 * @param path     separator-joined ancestry, self last
 * @param position sort order among siblings
 * @param level    depth in the tree, roots are level 0
 * @param name     display name, may be {@code null}
 */
public record Category(
        int id,
        int parentId,
        String path,
        int position,
        int level,
        String name) {

    public static final String PATH_SEPARATOR = "/";

    public Category {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Category " + id + " has no path");
        }
    }

    /**
     * Creates a tree root. The path consists of the id alone.
     */
    public static Category root(int id, String name) {
        return new Category(id, 0, String.valueOf(id), 0, 0, name);
    }

    /**
     * Creates a direct child of {@code parent}, deriving path and level from it.
     */
    public static Category childOf(Category parent, int id, String name, int position) {
        return new Category(id, parent.id(), parent.path() + PATH_SEPARATOR + id,
                position, parent.level() + 1, name);
    }

    /**
     * Returns the ids encoded in the path, root first and this category last.
     */
    public List<Integer> ancestorIds() {
        return idsOnPath(path);
    }

    /**
     * Returns {@code true} if this category sits strictly below the category
     * owning {@code ancestorPath}.
     */
    public boolean isDescendantOf(String ancestorPath) {
        return path.startsWith(ancestorPath + PATH_SEPARATOR);
    }

    /**
     * Splits a category path into its ids. Segments that are not integers are
     * rejected, since every segment of a well-formed path is a category id.
     *
     * @throws IllegalArgumentException for an empty or malformed path
     */
    public static List<Integer> idsOnPath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Empty category path");
        }
        String[] segments = path.split(PATH_SEPARATOR);
        List<Integer> ids = new ArrayList<>(segments.length);
        for (String segment : segments) {
            try {
                ids.add(Integer.parseInt(segment.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed category path: " + path, e);
            }
        }
        return ids;
    }
}
