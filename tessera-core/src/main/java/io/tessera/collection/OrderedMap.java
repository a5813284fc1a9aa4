package io.tessera.collection;

import io.tessera.core.ContainerConfiguration;
import io.tessera.table.OrderedArrayTable;
import io.tessera.table.TableCursor;

import java.util.Comparator;

/**
 * {@link KeyValueMap} backed by an {@link OrderedArrayTable}. Iterates in key
 * order and supports positional and range access.
 */
public final class OrderedMap<K, V> extends AbstractTableMap<K, V, OrderedArrayTable<K, Entry<K, V>>> {

    /**
     * Map ordered by the keys' natural order.
     */
    public OrderedMap() {
        super(new OrderedArrayTable<>(new EntryPolicy<>()));
    }

    public OrderedMap(Comparator<? super K> comparator) {
        super(new OrderedArrayTable<>(new EntryPolicy<>(), comparator));
    }

    public OrderedMap(Comparator<? super K> comparator, ContainerConfiguration configuration) {
        super(new OrderedArrayTable<>(new EntryPolicy<>(), comparator, configuration));
    }

    public OrderedMap(OrderedMap<K, V> other) {
        super(new OrderedArrayTable<>(other.table));
    }

    /**
     * Entry at sorted position {@code index}. Named apart from {@link #get(Object)}
     * so integer keys never select it by accident.
     */
    public Entry<K, V> at(int index) {
        return table.get(index);
    }

    public Entry<K, V> first() {
        return table.first();
    }

    public Entry<K, V> last() {
        return table.last();
    }

    public int lowerBound(K key) {
        return table.lowerBound(key);
    }

    public int upperBound(K key) {
        return table.upperBound(key);
    }

    public TableCursor<Entry<K, V>> lowerBoundCursor(K key) {
        return table.lowerBoundCursor(key);
    }

    public TableCursor<Entry<K, V>> upperBoundCursor(K key) {
        return table.upperBoundCursor(key);
    }

    /**
     * Remove entries at positions {@code [start, end)}.
     *
     * @return number of entries removed
     */
    public int removeRange(int start, int end) {
        return table.removeRange(start, end);
    }
}
