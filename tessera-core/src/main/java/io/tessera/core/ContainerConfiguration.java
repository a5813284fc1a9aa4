package io.tessera.core;

import java.util.Objects;

/**
 * Immutable tuning for sequences and tables.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * ContainerConfiguration config = ContainerConfiguration.builder()
 *     .initialBuckets(64)
 *     .loadFactor(0.75)
 *     .build();
 * </pre>
 * <p>
 * None of these values affect observable container contents; they only trade
 * memory for fewer reallocations and collisions.
 */
public final class ContainerConfiguration {

    private static final ContainerConfiguration DEFAULTS = builder().build();

    // Sequence buffers
    private final int minCapacity;
    private final double growthFactor;

    // Hash tables
    private final int initialBuckets;
    private final double loadFactor;

    // Sharing
    private final RefCounting refCounting;
    private final AllocationObserver allocationObserver;

    private ContainerConfiguration(Builder builder) {
        this.minCapacity = builder.minCapacity;
        this.growthFactor = builder.growthFactor;
        this.initialBuckets = builder.initialBuckets;
        this.loadFactor = builder.loadFactor;
        this.refCounting = builder.refCounting;
        this.allocationObserver = builder.allocationObserver;
    }

    /**
     * Shared default configuration.
     *
     * @return the default configuration
     */
    public static ContainerConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Create a new builder for ContainerConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Smallest capacity allocated for a sequence buffer.
     *
     * @return minimum capacity in items
     */
    public int minCapacity() {
        return minCapacity;
    }

    /**
     * Multiplier applied to a full buffer's capacity when it must grow.
     *
     * @return growth factor, always greater than 1
     */
    public double growthFactor() {
        return growthFactor;
    }

    /**
     * Bucket count of a hash table on its first insert.
     *
     * @return initial bucket count, a power of two
     */
    public int initialBuckets() {
        return initialBuckets;
    }

    /**
     * Occupancy fraction at which a hash table doubles its bucket array.
     *
     * @return load factor in (0, 1]
     */
    public double loadFactor() {
        return loadFactor;
    }

    public RefCounting refCounting() {
        return refCounting;
    }

    public AllocationObserver allocationObserver() {
        return allocationObserver;
    }

    /**
     * Initial capacity for a buffer that must hold {@code needed} items.
     */
    public int initialCapacity(int needed) {
        return Math.max(minCapacity, needed);
    }

    /**
     * Next capacity for a full buffer, never less than {@code needed}.
     */
    public int grownCapacity(int current, int needed) {
        var grown = (long) Math.ceil(current * growthFactor);
        if (grown <= current) {
            grown = current + 1L;
        }
        var result = Math.max(grown, Math.max(needed, minCapacity));
        return (int) Math.min(result, Integer.MAX_VALUE - 8);
    }

    /**
     * Grow threshold for the given bucket count.
     */
    public int growThreshold(int bucketCount) {
        return Math.max(1, (int) (bucketCount * loadFactor));
    }

    /**
     * Builder for ContainerConfiguration.
     */
    public static class Builder {
        private int minCapacity = 8;
        private double growthFactor = 2.0;
        private int initialBuckets = 8;
        private double loadFactor = 0.7;
        private RefCounting refCounting = RefCounting.PLAIN;
        private AllocationObserver allocationObserver = AllocationObserver.NOOP;

        private Builder() {
        }

        /**
         * Set the smallest capacity allocated for a sequence buffer.
         *
         * @param minCapacity minimum capacity, at least 1
         * @return this builder for method chaining
         */
        public Builder minCapacity(int minCapacity) {
            if (minCapacity < 1) {
                throw new IllegalArgumentException("minCapacity must be positive");
            }
            this.minCapacity = minCapacity;
            return this;
        }

        /**
         * Set the growth multiplier for full buffers.
         *
         * @param growthFactor factor greater than 1
         * @return this builder for method chaining
         */
        public Builder growthFactor(double growthFactor) {
            if (!(growthFactor > 1.0)) {
                throw new IllegalArgumentException("growthFactor must be greater than 1");
            }
            this.growthFactor = growthFactor;
            return this;
        }

        /**
         * Set the bucket count used on a hash table's first insert.
         *
         * @param initialBuckets power of two, at least 2
         * @return this builder for method chaining
         */
        public Builder initialBuckets(int initialBuckets) {
            if (initialBuckets < 2 || Integer.bitCount(initialBuckets) != 1) {
                throw new IllegalArgumentException("initialBuckets must be a power of two >= 2");
            }
            this.initialBuckets = initialBuckets;
            return this;
        }

        /**
         * Set the occupancy fraction that triggers a rehash.
         *
         * @param loadFactor value in (0, 1]
         * @return this builder for method chaining
         */
        public Builder loadFactor(double loadFactor) {
            if (!(loadFactor > 0.0) || loadFactor > 1.0) {
                throw new IllegalArgumentException("loadFactor must be in (0, 1]");
            }
            this.loadFactor = loadFactor;
            return this;
        }

        public Builder refCounting(RefCounting refCounting) {
            this.refCounting = Objects.requireNonNull(refCounting, "refCounting");
            return this;
        }

        public Builder allocationObserver(AllocationObserver allocationObserver) {
            this.allocationObserver = Objects.requireNonNull(allocationObserver, "allocationObserver");
            return this;
        }

        /**
         * Build the immutable ContainerConfiguration.
         *
         * @return a new ContainerConfiguration instance
         */
        public ContainerConfiguration build() {
            return new ContainerConfiguration(this);
        }
    }
}
