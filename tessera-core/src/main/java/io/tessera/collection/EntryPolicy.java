package io.tessera.collection;

import io.tessera.table.ItemPolicy;

final class EntryPolicy<K, V> implements ItemPolicy<K, Entry<K, V>> {

    @Override
    public K key(Entry<K, V> item) {
        return item.key();
    }

    @Override
    public Entry<K, V> create(K key) {
        return new Entry<>(key, null);
    }

    @Override
    public Entry<K, V> copy(Entry<K, V> item) {
        return new Entry<>(item);
    }
}
