package io.tessera.table;

/**
 * Position within an {@link AssociativeTable}.
 * <p>
 * A cursor stays usable across its own {@link #remove(Direction)} calls. Any
 * other change to the table leaves the cursor position unspecified.
 *
 * @param <E> stored item type
 */
public interface TableCursor<E> {

    boolean isValid();

    /**
     * Item at the cursor.
     *
     * @return the item, or null if the cursor is not valid
     */
    E item();

    /**
     * Advance in iteration order. From before the first item this moves to the
     * first item.
     *
     * @return true if the cursor is valid afterwards
     */
    boolean next();

    /**
     * Step back in iteration order. From past the last item this moves to the
     * last item.
     *
     * @return true if the cursor is valid afterwards
     */
    boolean previous();

    /**
     * Remove the item at the cursor and reposition as {@code direction} says.
     *
     * @return the removed item, or null if the cursor was not valid
     */
    E remove(Direction direction);
}
