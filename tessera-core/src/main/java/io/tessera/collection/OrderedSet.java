package io.tessera.collection;

import io.tessera.core.ContainerConfiguration;
import io.tessera.table.ItemPolicy;
import io.tessera.table.OrderedArrayTable;
import io.tessera.table.TableCursor;

import java.util.Comparator;

/**
 * {@link KeySet} backed by an {@link OrderedArrayTable}, iterating in key order.
 */
public final class OrderedSet<T> extends AbstractTableSet<T, OrderedArrayTable<T, T>> {

    public OrderedSet() {
        super(new OrderedArrayTable<>(ItemPolicy.identity()));
    }

    public OrderedSet(Comparator<? super T> comparator) {
        super(new OrderedArrayTable<>(ItemPolicy.identity(), comparator));
    }

    public OrderedSet(Comparator<? super T> comparator, ContainerConfiguration configuration) {
        super(new OrderedArrayTable<>(ItemPolicy.identity(), comparator, configuration));
    }

    public OrderedSet(OrderedSet<T> other) {
        super(new OrderedArrayTable<>(other.table));
    }

    @SafeVarargs
    public static <T> OrderedSet<T> of(T... keys) {
        var set = new OrderedSet<T>();
        set.reserve(keys.length);
        for (var key : keys) {
            set.add(key);
        }
        return set;
    }

    /**
     * Key at sorted position {@code index}.
     */
    public T at(int index) {
        return table.get(index);
    }

    public T first() {
        return table.first();
    }

    public T last() {
        return table.last();
    }

    public int lowerBound(T key) {
        return table.lowerBound(key);
    }

    public int upperBound(T key) {
        return table.upperBound(key);
    }

    public TableCursor<T> lowerBoundCursor(T key) {
        return table.lowerBoundCursor(key);
    }

    public int removeRange(int start, int end) {
        return table.removeRange(start, end);
    }
}
