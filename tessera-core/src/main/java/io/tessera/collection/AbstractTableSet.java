package io.tessera.collection;

import io.tessera.table.AssociativeTable;
import io.tessera.table.TableCursor;

import java.util.Iterator;

/**
 * {@link KeySet} over any {@link AssociativeTable} whose items are their keys.
 */
abstract class AbstractTableSet<E, T extends AssociativeTable<E, E>> implements KeySet<E> {

    final T table;

    AbstractTableSet(T table) {
        this.table = table;
    }

    @Override
    public boolean contains(E key) {
        return table.contains(key);
    }

    @Override
    public boolean add(E key) {
        return table.getOrInsert(key).created();
    }

    @Override
    public boolean remove(E key) {
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
    public TableCursor<E> cursor() {
        return table.cursor();
    }

    @Override
    public Iterator<E> iterator() {
        return table.iterator();
    }

    @Override
    @SuppressWarnings("unchecked")
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KeySet<?> other) || other.size() != size()) {
            return false;
        }
        var typed = (KeySet<E>) other;
        for (var key : this) {
            if (!typed.contains(key)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        var hash = 0;
        for (var key : this) {
            hash += key.hashCode();
        }
        return hash;
    }

    @Override
    public String toString() {
        return table.toString();
    }
}
