package io.tessera.collection;

import io.tessera.table.AssociativeTable;
import io.tessera.table.TableCursor;

import java.util.Iterator;
import java.util.Objects;

/**
 * {@link KeyValueMap} over any {@link AssociativeTable} of entries.
 */
abstract class AbstractTableMap<K, V, T extends AssociativeTable<K, Entry<K, V>>> implements KeyValueMap<K, V> {

    final T table;

    AbstractTableMap(T table) {
        this.table = table;
    }

    @Override
    public V get(K key) {
        var entry = table.find(key);
        return entry == null ? null : entry.value();
    }

    @Override
    public V getOrDefault(K key, V defaultValue) {
        var entry = table.find(key);
        return entry == null ? defaultValue : entry.value();
    }

    @Override
    public Entry<K, V> find(K key) {
        return table.find(key);
    }

    @Override
    public boolean containsKey(K key) {
        return table.contains(key);
    }

    @Override
    public boolean contains(K key, V value) {
        var entry = table.find(key);
        return entry != null && Objects.equals(entry.value(), value);
    }

    @Override
    public Entry<K, V> getOrCreate(K key) {
        return table.getOrInsert(key).item();
    }

    @Override
    public V put(K key, V value) {
        return table.getOrInsert(key).item().setValue(value);
    }

    @Override
    public boolean add(K key, V value, boolean update) {
        var insertion = table.getOrInsert(key);
        if (insertion.created() || update) {
            insertion.item().setValue(value);
        }
        return insertion.created();
    }

    @Override
    public boolean remove(K key) {
        return table.remove(key);
    }

    @Override
    public int size() {
        return table.size();
    }

    @Override
    public void clear() {
        table.clear();
    }

    @Override
    public void reserve(int extra) {
        table.reserve(extra);
    }

    @Override
    public void unshare() {
        table.unshare();
    }

    @Override
    public boolean isShared() {
        return table.isShared();
    }

    @Override
    public TableCursor<Entry<K, V>> cursor() {
        return table.cursor();
    }

    @Override
    public Iterator<Entry<K, V>> iterator() {
        return table.iterator();
    }

    @Override
    @SuppressWarnings("unchecked")
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KeyValueMap<?, ?> other) || other.size() != size()) {
            return false;
        }
        var typed = (KeyValueMap<K, V>) other;
        for (var entry : this) {
            var match = typed.find(entry.key());
            if (match == null || !Objects.equals(match.value(), entry.value())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        var hash = 0;
        for (var entry : this) {
            hash += entry.hashCode();
        }
        return hash;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("{");
        for (var entry : this) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(entry);
        }
        return sb.append('}').toString();
    }
}
