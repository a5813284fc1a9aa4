package io.tessera.table;

/**
 * Keyed collection of unique items.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>Keys are never null; a null key raises {@link IllegalArgumentException}.</li>
 *   <li>{@link #size()} equals the number of items iteration visits, and every
 *       visited item is found by its key.</li>
 *   <li>Copies share storage until one of them is written.</li>
 *   <li>Items returned by {@link #find(Object)} may still be shared and must
 *       not be mutated; {@link #getOrInsert(Object)} returns a private item.</li>
 * </ul>
 *
 * @param <K> key type
 * @param <E> stored item type
 */
public interface AssociativeTable<K, E> extends Iterable<E> {

    /**
     * @return the item stored under {@code key}, or null
     */
    E find(K key);

    default boolean contains(K key) {
        return find(key) != null;
    }

    /**
     * Return the item for {@code key}, creating it through the item policy if
     * it is absent.
     */
    Insertion<E> getOrInsert(K key);

    /**
     * @return true if an item was removed
     */
    boolean remove(K key);

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    void clear();

    /**
     * Number of items the table can hold before it reallocates.
     */
    int capacity();

    /**
     * Pre-size for {@code expected} items. Never drops items.
     */
    void capacity(int expected);

    /**
     * Make room for {@code extra} more items.
     */
    default void reserve(int extra) {
        if (extra > 0) {
            capacity(size() + extra);
        }
    }

    /**
     * Detach from any table this one shares storage with.
     */
    void unshare();

    boolean isShared();

    /**
     * @return cursor positioned before the first item
     */
    TableCursor<E> cursor();

    /**
     * @return cursor at {@code key}'s item, or past the last item if the key is absent
     */
    TableCursor<E> cursor(K key);
}
