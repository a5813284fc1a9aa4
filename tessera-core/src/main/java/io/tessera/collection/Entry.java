package io.tessera.collection;

import java.util.Objects;

/**
 * Key with a mutable value, as stored by a {@link KeyValueMap}.
 * <p>
 * Entries are copied when a shared map is detached, so a value set through an
 * entry obtained from a write operation never shows in another map. The value
 * object itself is not copied.
 */
public final class Entry<K, V> {
    private final K key;
    private V value;

    public Entry(K key, V value) {
        if (key == null) {
            throw new IllegalArgumentException("key required");
        }
        this.key = key;
        this.value = value;
    }

    public Entry(Entry<K, V> other) {
        this(other.key, other.value);
    }

    public K key() {
        return key;
    }

    public V value() {
        return value;
    }

    /**
     * @return the previous value
     */
    public V setValue(V value) {
        var previous = this.value;
        this.value = value;
        return previous;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Entry<?, ?> other)) {
            return false;
        }
        return key.equals(other.key) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return key.hashCode() ^ Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }
}
