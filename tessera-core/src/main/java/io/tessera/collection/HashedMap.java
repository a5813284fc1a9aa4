package io.tessera.collection;

import io.tessera.core.ContainerConfiguration;
import io.tessera.table.BucketedHashTable;
import io.tessera.table.Hasher;

import java.util.Comparator;

/**
 * {@link KeyValueMap} backed by a {@link BucketedHashTable}. Iteration order
 * follows the bucket layout.
 * <p>
 * Keys are matched with {@code equals} unless a comparator is given, in which
 * case the comparator decides equality and orders colliding keys.
 */
public final class HashedMap<K, V> extends AbstractTableMap<K, V, BucketedHashTable<K, Entry<K, V>>> {

    public HashedMap() {
        super(new BucketedHashTable<>(new EntryPolicy<>()));
    }

    public HashedMap(Hasher<? super K> hasher, ContainerConfiguration configuration) {
        super(new BucketedHashTable<>(new EntryPolicy<>(), hasher, configuration));
    }

    public HashedMap(Comparator<? super K> comparator) {
        super(new BucketedHashTable<>(new EntryPolicy<>(), comparator));
    }

    public HashedMap(Comparator<? super K> comparator, Hasher<? super K> hasher,
                     ContainerConfiguration configuration) {
        super(new BucketedHashTable<>(new EntryPolicy<>(), comparator, hasher, configuration));
    }

    /**
     * Copy sharing {@code other}'s storage until either map is written.
     */
    public HashedMap(HashedMap<K, V> other) {
        super(new BucketedHashTable<>(other.table));
    }

    public int bucketCount() {
        return table.bucketCount();
    }

    /**
     * Pre-size the bucket array for {@code expected} entries.
     */
    public void capacity(int expected) {
        table.capacity(expected);
    }
}
