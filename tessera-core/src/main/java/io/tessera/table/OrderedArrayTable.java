package io.tessera.table;

import io.tessera.core.ContainerConfiguration;
import io.tessera.sequence.Sequence;

import java.util.Comparator;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Associative table kept as one sorted {@link Sequence}.
 * <p>
 * Lookups are binary searches; inserts and removes shift the shorter side of
 * the sequence. Iteration is in key order, which makes this table the right
 * choice for range queries and small maps.
 *
 * @param <K> key type
 * @param <E> stored item type
 */
public final class OrderedArrayTable<K, E> implements AssociativeTable<K, E> {

    private final ItemPolicy<K, E> policy;
    private final Comparator<? super K> comparator;
    private final Sequence<E> items;

    /**
     * Table ordered by the keys' natural order. Keys must be {@link Comparable}.
     */
    public OrderedArrayTable(ItemPolicy<K, E> policy) {
        this(policy, KeySearch.natural(), ContainerConfiguration.defaults());
    }

    public OrderedArrayTable(ItemPolicy<K, E> policy, Comparator<? super K> comparator) {
        this(policy, comparator, ContainerConfiguration.defaults());
    }

    public OrderedArrayTable(ItemPolicy<K, E> policy, Comparator<? super K> comparator,
                             ContainerConfiguration configuration) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.comparator = Objects.requireNonNull(comparator, "comparator");
        this.items = new Sequence<>(configuration, policy::copy);
    }

    /**
     * Copy sharing {@code other}'s storage until either table is written.
     */
    public OrderedArrayTable(OrderedArrayTable<K, E> other) {
        this.policy = other.policy;
        this.comparator = other.comparator;
        this.items = new Sequence<>(other.items);
    }

    @Override
    public E find(K key) {
        KeySearch.requireKey(key);
        var index = KeySearch.search(items, key, policy, comparator);
        return index >= 0 ? items.get(index) : null;
    }

    /**
     * @return position of {@code key}, or {@link Sequence#NOT_FOUND}
     */
    public int indexOf(K key) {
        KeySearch.requireKey(key);
        var index = KeySearch.search(items, key, policy, comparator);
        return index >= 0 ? index : Sequence.NOT_FOUND;
    }

    @Override
    public Insertion<E> getOrInsert(K key) {
        KeySearch.requireKey(key);
        var index = KeySearch.search(items, key, policy, comparator);
        if (index >= 0) {
            return new Insertion<>(items.getMutable(index), false);
        }
        var item = policy.create(key);
        items.insert(-(index + 1), item);
        return new Insertion<>(item, true);
    }

    @Override
    public boolean remove(K key) {
        KeySearch.requireKey(key);
        var index = KeySearch.search(items, key, policy, comparator);
        return index >= 0 && items.remove(index, 1) == 1;
    }

    /**
     * Remove {@code count} items starting at position {@code index}.
     *
     * @return number of items removed
     */
    public int removeAt(int index, int count) {
        return items.remove(index, count);
    }

    /**
     * Remove positions {@code [start, end)} in one bulk shift.
     *
     * @return number of items removed
     */
    public int removeRange(int start, int end) {
        start = Math.max(start, 0);
        end = Math.min(end, items.size());
        return start < end ? items.remove(start, end - start) : 0;
    }

    /**
     * Position of the first item whose key is not less than {@code key}.
     *
     * @return position in {@code [0, size]}
     */
    public int lowerBound(K key) {
        KeySearch.requireKey(key);
        return KeySearch.bound(items, key, policy, comparator, false);
    }

    /**
     * Position of the first item whose key is greater than {@code key}.
     *
     * @return position in {@code [0, size]}
     */
    public int upperBound(K key) {
        KeySearch.requireKey(key);
        return KeySearch.bound(items, key, policy, comparator, true);
    }

    public TableCursor<E> lowerBoundCursor(K key) {
        return new Cursor(lowerBound(key));
    }

    public TableCursor<E> upperBoundCursor(K key) {
        return new Cursor(upperBound(key));
    }

    /**
     * Item at sorted position {@code index}. Unchecked apart from assertions.
     */
    public E get(int index) {
        return items.get(index);
    }

    /**
     * @return smallest item, or null if empty
     */
    public E first() {
        return items.first();
    }

    /**
     * @return largest item, or null if empty
     */
    public E last() {
        return items.last();
    }

    @Override
    public int size() {
        return items.size();
    }

    @Override
    public void clear() {
        items.clear();
    }

    @Override
    public int capacity() {
        return items.capacity();
    }

    @Override
    public void capacity(int expected) {
        if (expected > items.capacity() || items.isShared()) {
            items.reserve(Math.max(expected - items.size(), 0));
        }
    }

    @Override
    public void unshare() {
        items.unshare();
    }

    @Override
    public boolean isShared() {
        return items.isShared();
    }

    @Override
    public TableCursor<E> cursor() {
        return new Cursor(-1);
    }

    @Override
    public TableCursor<E> cursor(K key) {
        var index = indexOf(key);
        return new Cursor(index >= 0 ? index : items.size());
    }

    @Override
    public Iterator<E> iterator() {
        return new Iterator<>() {
            private final Cursor cursor = new Cursor(-1);
            private boolean removable;

            @Override
            public boolean hasNext() {
                return cursor.position + 1 < items.size();
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
        return items.toString();
    }

    private final class Cursor implements TableCursor<E> {
        private int position;

        private Cursor(int position) {
            this.position = position;
        }

        @Override
        public boolean isValid() {
            return position >= 0 && position < items.size();
        }

        @Override
        public E item() {
            return isValid() ? items.get(position) : null;
        }

        @Override
        public boolean next() {
            if (position < items.size()) {
                position++;
            }
            return isValid();
        }

        @Override
        public boolean previous() {
            if (position >= 0) {
                position--;
            }
            return isValid();
        }

        @Override
        public E remove(Direction direction) {
            if (!isValid()) {
                return null;
            }
            var removed = items.get(position);
            items.remove(position, 1);
            switch (direction) {
                case NONE -> position = items.size();
                case FORWARD -> {
                }
                case REVERSE -> position--;
            }
            return removed;
        }
    }
}
