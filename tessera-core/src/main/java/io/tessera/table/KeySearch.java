package io.tessera.table;

import io.tessera.sequence.Sequence;

import java.util.Comparator;

/**
 * Binary search over a sequence sorted by item key.
 */
final class KeySearch {

    private KeySearch() {
    }

    /**
     * @return index of the item with {@code key}, or {@code -(insertionPoint + 1)}
     */
    static <K, E> int search(Sequence<E> items, K key, ItemPolicy<K, E> policy, Comparator<? super K> comparator) {
        var low = 0;
        var high = items.size() - 1;
        while (low <= high) {
            var mid = (low + high) >>> 1;
            var cmp = comparator.compare(policy.key(items.get(mid)), key);
            if (cmp < 0) {
                low = mid + 1;
            } else if (cmp > 0) {
                high = mid - 1;
            } else {
                return mid;
            }
        }
        return -(low + 1);
    }

    /**
     * Search a sequence sorted by key hash, matching keys with {@code equals}.
     * Keys with equal hashes are scanned linearly.
     *
     * @return index of the item with {@code key}, or {@code -(insertionPoint + 1)}
     */
    static <K, E> int searchByHash(Sequence<E> items, K key, ItemPolicy<K, E> policy, Hasher<? super K> hasher) {
        var hash = hasher.hash(key);
        var low = 0;
        var high = items.size();
        while (low < high) {
            var mid = (low + high) >>> 1;
            if (hasher.hash(policy.key(items.get(mid))) < hash) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        var index = low;
        while (index < items.size()) {
            var candidate = policy.key(items.get(index));
            if (hasher.hash(candidate) != hash) {
                break;
            }
            if (key.equals(candidate)) {
                return index;
            }
            index++;
        }
        return -(index + 1);
    }

    /**
     * First index whose key is not less than {@code key} (or greater, when
     * {@code strict}).
     */
    static <K, E> int bound(Sequence<E> items, K key, ItemPolicy<K, E> policy, Comparator<? super K> comparator,
                            boolean strict) {
        var low = 0;
        var high = items.size();
        while (low < high) {
            var mid = (low + high) >>> 1;
            var cmp = comparator.compare(policy.key(items.get(mid)), key);
            if (cmp < 0 || (strict && cmp == 0)) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    @SuppressWarnings("unchecked")
    static <K> Comparator<K> natural() {
        return (Comparator<K>) Comparator.naturalOrder();
    }

    static void requireKey(Object key) {
        if (key == null) {
            throw new IllegalArgumentException("key required");
        }
    }
}
