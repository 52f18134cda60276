package de.bsommerfeld.catalog.core.util;

import de.bsommerfeld.catalog.core.domain.Category;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates a dummy category tree for offline development and TEST mode.
 *
 * <h3>What the output looks like</h3>
 * <ul>
 * <li>A single root with id 1 ("Root Catalog"), mirroring a store's
 * invisible tree root</li>
 * <li>A default category with id 2 below it, under which every generated
 * branch hangs</li>
 * <li>Further levels down to {@code depth}, each node with
 * {@code 1..maxChildren} children named from a fixed pool</li>
 * <li>Ids are assigned sequentially in breadth-first order, so a parent's id is
 * always lower than its children's</li>
 * </ul>
 *
 * A fixed seed produces the same tree on every call, which is what the tests
 * rely on.
 */
public final class CategoryTreeGenerator {

    public static final int ROOT_ID = 1;
    public static final int DEFAULT_CATEGORY_ID = 2;

    private static final String[] NAMES = { "Men", "Women", "Gear", "Bags", "Tops", "Bottoms", "Jackets",
            "Shoes", "Sale", "New Arrivals", "Accessories", "Fitness" };

    private CategoryTreeGenerator() {
    }

    /**
     * @param depth       levels below the default category (0 yields just root
     *                    and default category)
     * @param maxChildren upper bound of children per node, at least 1
     * @param seed        random seed for the child counts and names
     * @return all categories in breadth-first order, root first
     */
    public static List<Category> generateTree(int depth, int maxChildren, long seed) {
        if (maxChildren < 1) {
            throw new IllegalArgumentException("maxChildren must be at least 1");
        }
        Random rnd = new Random(seed);
        List<Category> all = new ArrayList<>();

        Category root = Category.root(ROOT_ID, "Root Catalog");
        Category defaultCategory = Category.childOf(root, DEFAULT_CATEGORY_ID, "Default Category", 1);
        all.add(root);
        all.add(defaultCategory);

        int nextId = DEFAULT_CATEGORY_ID + 1;
        List<Category> level = List.of(defaultCategory);
        for (int d = 0; d < depth; d++) {
            List<Category> next = new ArrayList<>();
            for (Category parent : level) {
                int children = 1 + rnd.nextInt(maxChildren);
                for (int position = 1; position <= children; position++) {
                    String name = NAMES[rnd.nextInt(NAMES.length)];
                    Category child = Category.childOf(parent, nextId++, name, position);
                    next.add(child);
                }
            }
            all.addAll(next);
            level = next;
        }
        return all;
    }
}
