package io.tessera.collection;

import io.tessera.table.TableCursor;

/**
 * Copy-on-write set of keys.
 *
 * @param <T> key type
 */
public interface KeySet<T> extends Iterable<T> {

    boolean contains(T key);

    /**
     * @return true if the key was not present
     */
    boolean add(T key);

    /**
     * @return number of keys that were not present
     */
    default int addAll(Iterable<? extends T> keys) {
        var added = 0;
        for (var key : keys) {
            if (add(key)) {
                added++;
            }
        }
        return added;
    }

    /**
     * @return true if the key was present
     */
    boolean remove(T key);

    /**
     * @return number of keys removed
     */
    default int removeAll(Iterable<? extends T> keys) {
        var removed = 0;
        for (var key : keys) {
            if (remove(key)) {
                removed++;
            }
        }
        return removed;
    }

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    void clear();

    void reserve(int extra);

    void unshare();

    boolean isShared();

    TableCursor<T> cursor();
}
