package io.tessera.table;

import io.tessera.core.ContainerConfiguration;
import io.tessera.sequence.Sequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Hash table over a sparse array of buckets.
 * <p>
 * Each bucket holds one inline item plus an overflow sequence sorted by the
 * comparator, or by key hash when there is none, so a lookup is one comparison
 * in the common case and a binary search under collisions. The bucket array is itself a {@link Sequence}: copying a table is
 * O(1) and the first write detaches it.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>The bucket count is zero or a power of two.</li>
 *   <li>{@code size <= growThreshold} after every operation; inserting a new key
 *       into a full table doubles the bucket count first.</li>
 *   <li>Removing a bucket's inline item promotes the last overflow item; an
 *       emptied bucket is dropped from the array.</li>
 *   <li>Iteration visits buckets in index order, inline item first.</li>
 * </ul>
 *
 * @param <K> key type
 * @param <E> stored item type
 */
public final class BucketedHashTable<K, E> implements AssociativeTable<K, E> {
    private static final Logger log = LoggerFactory.getLogger(BucketedHashTable.class);

    private final ContainerConfiguration configuration;
    private final ItemPolicy<K, E> policy;
    // null: equals matching with overflow ordered by hash
    private final Comparator<? super K> comparator;
    private final Hasher<? super K> hasher;

    private final Sequence<Bucket<E>> buckets;
    private int size;
    private int sizeMask;
    private int growThreshold;

    /**
     * Table with the standard hasher. Keys are matched with {@code equals}, and
     * colliding keys are ordered by their full hash.
     */
    public BucketedHashTable(ItemPolicy<K, E> policy) {
        this(policy, Hasher.standard(), ContainerConfiguration.defaults());
    }

    public BucketedHashTable(ItemPolicy<K, E> policy, Hasher<? super K> hasher, ContainerConfiguration configuration) {
        this(configuration, policy, null, hasher);
    }

    /**
     * Table whose colliding keys are ordered by {@code comparator}, which also
     * decides key equality.
     */
    public BucketedHashTable(ItemPolicy<K, E> policy, Comparator<? super K> comparator) {
        this(policy, comparator, Hasher.standard(), ContainerConfiguration.defaults());
    }

    public BucketedHashTable(ItemPolicy<K, E> policy, Comparator<? super K> comparator,
                             Hasher<? super K> hasher, ContainerConfiguration configuration) {
        this(configuration, policy, Objects.requireNonNull(comparator, "comparator"), hasher);
    }

    private BucketedHashTable(ContainerConfiguration configuration, ItemPolicy<K, E> policy,
                              Comparator<? super K> comparator, Hasher<? super K> hasher) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.comparator = comparator;
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.buckets = new Sequence<>(configuration, this::copyBucket);
    }

    /**
     * Copy sharing {@code other}'s buckets until either table is written.
     */
    public BucketedHashTable(BucketedHashTable<K, E> other) {
        this.configuration = other.configuration;
        this.policy = other.policy;
        this.comparator = other.comparator;
        this.hasher = other.hasher;
        this.buckets = new Sequence<>(configuration, this::copyBucket);
        this.buckets.reference(other.buckets);
        this.size = other.size;
        this.sizeMask = other.sizeMask;
        this.growThreshold = other.growThreshold;
    }

    @Override
    public E find(K key) {
        KeySearch.requireKey(key);
        if (size == 0) {
            return null;
        }
        var bucket = buckets.get(indexFor(key));
        if (bucket == null) {
            return null;
        }
        if (matches(bucket.primary, key)) {
            return bucket.primary;
        }
        if (bucket.overflow == null) {
            return null;
        }
        var index = searchOverflow(bucket.overflow, key);
        return index >= 0 ? bucket.overflow.get(index) : null;
    }

    @Override
    public Insertion<E> getOrInsert(K key) {
        KeySearch.requireKey(key);
        if (bucketCount() == 0) {
            rehash(configuration.initialBuckets());
        }
        buckets.unshare();
        var slot = indexFor(key);
        var bucket = buckets.get(slot);
        if (bucket != null) {
            if (matches(bucket.primary, key)) {
                return new Insertion<>(bucket.primary, false);
            }
            if (bucket.overflow != null) {
                var index = searchOverflow(bucket.overflow, key);
                if (index >= 0) {
                    return new Insertion<>(bucket.overflow.getMutable(index), false);
                }
            }
        }
        if (size >= growThreshold) {
            rehash(bucketCount() << 1);
            slot = indexFor(key);
        }
        var item = policy.create(key);
        place(buckets, slot, item);
        size++;
        return new Insertion<>(item, true);
    }

    @Override
    public boolean remove(K key) {
        KeySearch.requireKey(key);
        if (size == 0) {
            return false;
        }
        var slot = indexFor(key);
        var bucket = buckets.get(slot);
        if (bucket == null) {
            return false;
        }
        if (matches(bucket.primary, key)) {
            removeAt(slot, 0);
            return true;
        }
        if (bucket.overflow == null) {
            return false;
        }
        var index = searchOverflow(bucket.overflow, key);
        if (index < 0) {
            return false;
        }
        removeAt(slot, index + 1);
        return true;
    }

    @Override
    public int size() {
        return size;
    }

    /**
     * Release all items. The bucket array is dropped; the next insert starts
     * again from the initial bucket count.
     */
    @Override
    public void clear() {
        buckets.setNull();
        size = 0;
        sizeMask = 0;
        growThreshold = 0;
    }

    public int bucketCount() {
        return buckets.size();
    }

    /**
     * Items the table holds before its next rehash.
     */
    @Override
    public int capacity() {
        return growThreshold;
    }

    /**
     * Rehash to the smallest bucket count whose grow threshold fits
     * {@code expected} items and the current size.
     */
    @Override
    public void capacity(int expected) {
        var needed = Math.max(expected, size);
        var count = configuration.initialBuckets();
        while (configuration.growThreshold(count) < needed && count < (1 << 30)) {
            count <<= 1;
        }
        if (count != bucketCount()) {
            rehash(count);
        }
    }

    /**
     * Rehash into {@code bucketCount} buckets, rounded up to a power of two
     * large enough for the current size.
     */
    public void resize(int bucketCount) {
        var count = Math.max(configuration.initialBuckets(), Integer.highestOneBit(Math.max(bucketCount - 1, 1)) << 1);
        while (configuration.growThreshold(count) < size) {
            count <<= 1;
        }
        if (count != bucketCount()) {
            rehash(count);
        }
    }

    @Override
    public void reserve(int extra) {
        if (extra > 0 && size + extra > growThreshold) {
            capacity(size + extra);
        }
    }

    @Override
    public void unshare() {
        buckets.unshare();
        for (var i = 0; i < buckets.size(); i++) {
            var bucket = buckets.get(i);
            if (bucket != null && bucket.overflow != null) {
                bucket.overflow.unshare();
            }
        }
    }

    @Override
    public boolean isShared() {
        return buckets.isShared();
    }

    /**
     * Number of items stored outside their bucket's inline slot.
     */
    public int collisions() {
        var count = 0;
        for (var bucket : buckets) {
            if (bucket != null && bucket.overflow != null) {
                count += bucket.overflow.size();
            }
        }
        return count;
    }

    @Override
    public TableCursor<E> cursor() {
        return new Cursor(-1, 0);
    }

    @Override
    public TableCursor<E> cursor(K key) {
        KeySearch.requireKey(key);
        if (size > 0) {
            var slot = indexFor(key);
            var bucket = buckets.get(slot);
            if (bucket != null) {
                if (matches(bucket.primary, key)) {
                    return new Cursor(slot, 0);
                }
                if (bucket.overflow != null) {
                    var index = searchOverflow(bucket.overflow, key);
                    if (index >= 0) {
                        return new Cursor(slot, index + 1);
                    }
                }
            }
        }
        return new Cursor(bucketCount(), 0);
    }

    @Override
    public Iterator<E> iterator() {
        return new Iterator<>() {
            private final Cursor cursor = new Cursor(-1, 0);
            private boolean removable;

            @Override
            public boolean hasNext() {
                var probe = new Cursor(cursor.bucket, cursor.slot);
                return probe.next();
            }

            @Override
            public E next() {
                if (!cursor.next()) {
                    throw new NoSuchElementException();
                }
                removable = true;
                return cursor.item();
            }

            @Override
            public void remove() {
                if (!removable) {
                    throw new IllegalStateException("next() not called");
                }
                removable = false;
                cursor.remove(Direction.REVERSE);
            }
        };
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("[");
        for (var item : this) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(item);
        }
        return sb.append(']').toString();
    }

    private int indexFor(K key) {
        return hasher.hash(key) & sizeMask;
    }

    private boolean matches(E item, K key) {
        return comparator != null ? comparator.compare(policy.key(item), key) == 0 : key.equals(policy.key(item));
    }

    private int searchOverflow(Sequence<E> overflow, K key) {
        return comparator != null
                ? KeySearch.search(overflow, key, policy, comparator)
                : KeySearch.searchByHash(overflow, key, policy, hasher);
    }

    private Bucket<E> copyBucket(Bucket<E> bucket) {
        if (bucket == null) {
            return null;
        }
        var copy = new Bucket<E>(policy.copy(bucket.primary));
        if (bucket.overflow != null) {
            copy.overflow = new Sequence<>(bucket.overflow);
        }
        return copy;
    }

    private void place(Sequence<Bucket<E>> target, int slot, E item) {
        var bucket = target.get(slot);
        if (bucket == null) {
            target.set(slot, new Bucket<>(item));
            return;
        }
        if (bucket.overflow == null) {
            bucket.overflow = new Sequence<>(configuration, policy::copy);
        }
        var index = searchOverflow(bucket.overflow, policy.key(item));
        assert index < 0 : "duplicate key";
        bucket.overflow.insert(-(index + 1), item);
    }

    /**
     * Remove the item at {@code slot} within {@code bucket}; slot 0 is the inline
     * item, slot {@code n > 0} is overflow item {@code n - 1}.
     */
    private E removeAt(int bucketIndex, int slot) {
        buckets.unshare();
        var bucket = buckets.get(bucketIndex);
        E removed;
        if (slot == 0) {
            removed = bucket.primary;
            if (bucket.overflow != null && !bucket.overflow.isEmpty()) {
                var promoted = bucket.overflow.pop();
                bucket.primary = bucket.overflow.isShared() ? policy.copy(promoted) : promoted;
            } else {
                buckets.set(bucketIndex, null);
            }
        } else {
            removed = bucket.overflow.get(slot - 1);
            bucket.overflow.remove(slot - 1, 1);
        }
        if (bucket.overflow != null && bucket.overflow.isEmpty()) {
            bucket.overflow.setNull();
            bucket.overflow = null;
        }
        size--;
        return removed;
    }

    private void rehash(int bucketCount) {
        assert Integer.bitCount(bucketCount) == 1;
        var oldCount = bucketCount();
        var owned = !buckets.isShared();
        var target = new Sequence<Bucket<E>>(configuration, this::copyBucket);
        target.resize(bucketCount);
        var mask = bucketCount - 1;
        for (var bucket : buckets) {
            if (bucket == null) {
                continue;
            }
            var primary = owned ? bucket.primary : policy.copy(bucket.primary);
            place(target, hasher.hash(policy.key(primary)) & mask, primary);
            if (bucket.overflow != null) {
                var overflowOwned = owned && !bucket.overflow.isShared();
                for (var item : bucket.overflow) {
                    var moved = overflowOwned ? item : policy.copy(item);
                    place(target, hasher.hash(policy.key(moved)) & mask, moved);
                }
                if (owned) {
                    bucket.overflow.setNull();
                }
            }
        }
        buckets.reference(target);
        target.setNull();
        sizeMask = mask;
        growThreshold = configuration.growThreshold(bucketCount);
        if (oldCount > 0) {
            log.debug("Rehashed {} items from {} to {} buckets", size, oldCount, bucketCount);
        }
    }

    private static final class Bucket<E> {
        E primary;
        Sequence<E> overflow;

        Bucket(E primary) {
            this.primary = primary;
        }
    }

    private final class Cursor implements TableCursor<E> {
        private int bucket;
        private int slot;

        private Cursor(int bucket, int slot) {
            this.bucket = bucket;
            this.slot = slot;
        }

        @Override
        public boolean isValid() {
            return bucket >= 0 && bucket < bucketCount();
        }

        @Override
        public E item() {
            if (!isValid()) {
                return null;
            }
            var current = buckets.get(bucket);
            return slot == 0 ? current.primary : current.overflow.get(slot - 1);
        }

        @Override
        public boolean next() {
            var current = isValid() ? buckets.get(bucket) : null;
            if (current != null && slot < entries(current) - 1) {
                slot++;
                return true;
            }
            var count = bucketCount();
            if (bucket < count) {
                bucket++;
            }
            while (bucket < count && buckets.get(bucket) == null) {
                bucket++;
            }
            slot = 0;
            return isValid();
        }

        @Override
        public boolean previous() {
            if (isValid() && slot > 0) {
                slot--;
                return true;
            }
            if (bucket >= 0) {
                bucket--;
            }
            while (bucket >= 0 && buckets.get(bucket) == null) {
                bucket--;
            }
            slot = bucket >= 0 ? entries(buckets.get(bucket)) - 1 : 0;
            return isValid();
        }

        @Override
        public E remove(Direction direction) {
            if (!isValid()) {
                return null;
            }
            var removed = removeAt(bucket, slot);
            switch (direction) {
                case NONE -> {
                    bucket = bucketCount();
                    slot = 0;
                }
                case FORWARD -> {
                    var current = buckets.get(bucket);
                    if (current == null || slot >= entries(current)) {
                        next();
                    }
                }
                case REVERSE -> {
                    if (slot > 0) {
                        slot--;
                    } else {
                        previous();
                    }
                }
            }
            return removed;
        }

        private int entries(Bucket<E> current) {
            return current.overflow == null ? 1 : 1 + current.overflow.size();
        }
    }
}
