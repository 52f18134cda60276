package de.bsommerfeld.catalog.core.event;

import java.util.List;

/**
 * Events describing changes to the category tree.
 */
public class CategoryEvents {

    /**
     * Fired after a category was created, updated or moved. {@code path} is the path the category had at the time
     * of the change; for a move the event is posted once per path.
     */
    public record CategoryTreeChangedEvent(int categoryId, String path) {
    }

    /**
     * Fired after a category was deleted together with its subtree.
     * {@code removedIds} lists every id that no longer exists, the category
     * itself included.
     */
    public record CategorySubtreeRemovedEvent(int categoryId, String path, List<Integer> removedIds) {

        public CategorySubtreeRemovedEvent {
            removedIds = List.copyOf(removedIds);
        }
    }

    /**
     * Fired after a bulk rewrite that may have touched any part of the tree.
     */
    public record CategoryTreeReloadedEvent() {
    }
}
