package io.tessera.collection;

import io.tessera.core.ContainerConfiguration;
import io.tessera.table.BucketedHashTable;
import io.tessera.table.Hasher;
import io.tessera.table.ItemPolicy;

import java.util.Comparator;

/**
 * {@link KeySet} backed by a {@link BucketedHashTable}.
 */
public final class HashedSet<T> extends AbstractTableSet<T, BucketedHashTable<T, T>> {

    public HashedSet() {
        super(new BucketedHashTable<>(ItemPolicy.identity()));
    }

    public HashedSet(Hasher<? super T> hasher, ContainerConfiguration configuration) {
        super(new BucketedHashTable<>(ItemPolicy.identity(), hasher, configuration));
    }

    public HashedSet(Comparator<? super T> comparator) {
        super(new BucketedHashTable<>(ItemPolicy.identity(), comparator));
    }

    public HashedSet(Comparator<? super T> comparator, Hasher<? super T> hasher,
                     ContainerConfiguration configuration) {
        super(new BucketedHashTable<>(ItemPolicy.identity(), comparator, hasher, configuration));
    }

    public HashedSet(HashedSet<T> other) {
        super(new BucketedHashTable<>(other.table));
    }

    @SafeVarargs
    public static <T> HashedSet<T> of(T... keys) {
        var set = new HashedSet<T>();
        set.reserve(keys.length);
        for (var key : keys) {
            set.add(key);
        }
        return set;
    }

    public int bucketCount() {
        return table.bucketCount();
    }
}
