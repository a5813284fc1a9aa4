package io.tessera.table;

/**
 * How a table derives keys from its items and creates or copies items.
 *
 * @param <K> key type
 * @param <E> stored item type
 */
public interface ItemPolicy<K, E> {

    K key(E item);

    /**
     * Create the item stored for a key that was not present.
     */
    E create(K key);

    /**
     * Copy an item when a shared table is detached. Identity is correct for
     * immutable items.
     */
    default E copy(E item) {
        return item;
    }

    /**
     * Policy for tables whose items are their own keys.
     */
    static <K> ItemPolicy<K, K> identity() {
        return new ItemPolicy<>() {
            @Override
            public K key(K item) {
                return item;
            }

            @Override
            public K create(K key) {
                return key;
            }
        };
    }
}
