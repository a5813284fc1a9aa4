package io.tessera.collection;

import io.tessera.table.Direction;
import io.tessera.table.TableCursor;

/**
 * Copy-on-write map from keys to values.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>Null keys raise {@link IllegalArgumentException}; null values are allowed.</li>
 *   <li>Copying a map is O(1). The first write to either copy detaches it.</li>
 *   <li>Missing keys are reported with null or false, never an exception.</li>
 * </ul>
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface KeyValueMap<K, V> extends Iterable<Entry<K, V>> {

    /**
     * @return value for {@code key}, or null if absent
     */
    V get(K key);

    V getOrDefault(K key, V defaultValue);

    /**
     * Entry for {@code key} for reading. Its value must not be changed.
     *
     * @return the entry, or null if absent
     */
    Entry<K, V> find(K key);

    boolean containsKey(K key);

    /**
     * @return true if {@code key} maps to a value equal to {@code value}
     */
    boolean contains(K key, V value);

    /**
     * Writable entry for {@code key}, created with a null value if absent.
     */
    Entry<K, V> getOrCreate(K key);

    /**
     * Set the value for {@code key}.
     *
     * @return the previous value, or null
     */
    V put(K key, V value);

    /**
     * Insert {@code key}, or overwrite its value when {@code update} is set.
     *
     * @return true if the key was inserted
     */
    boolean add(K key, V value, boolean update);

    default void putAll(KeyValueMap<? extends K, ? extends V> other) {
        reserve(other.size());
        for (var entry : other) {
            put(entry.key(), entry.value());
        }
    }

    /**
     * @return true if the key was present
     */
    boolean remove(K key);

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    void clear();

    void reserve(int extra);

    void unshare();

    boolean isShared();

    /**
     * @return cursor positioned before the first entry
     */
    TableCursor<Entry<K, V>> cursor();

    /**
     * Take the entry at {@code cursor} out of another map and put it into this
     * one, replacing any value already stored under its key. The cursor is
     * repositioned as {@link TableCursor#remove(Direction)} describes.
     *
     * @return false if the cursor was not valid
     */
    default boolean move(TableCursor<Entry<K, V>> cursor, Direction direction) {
        if (!cursor.isValid()) {
            return false;
        }
        var entry = cursor.remove(direction);
        put(entry.key(), entry.value());
        return true;
    }
}
