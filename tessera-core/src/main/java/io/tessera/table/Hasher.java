package io.tessera.table;

/**
 * Hash function for table keys.
 * <p>
 * Only the low bits select a bucket, so implementations should mix high bits
 * downward.
 */
@FunctionalInterface
public interface Hasher<K> {

    int hash(K key);

    /**
     * {@link Object#hashCode()} with the high half folded into the low half.
     */
    static <K> Hasher<K> standard() {
        return key -> {
            var h = key.hashCode();
            return h ^ (h >>> 16);
        };
    }
}
