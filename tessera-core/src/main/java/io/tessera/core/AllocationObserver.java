package io.tessera.core;

/**
 * Callback for shared buffer lifecycle events.
 * <p>
 * Invoked synchronously on the thread that allocates, resizes or releases a
 * buffer. Implementations must be cheap; they sit on the growth path of every
 * sequence built with the owning configuration.
 */
public interface AllocationObserver {

    AllocationObserver NOOP = new AllocationObserver() {
    };

    /**
     * A new buffer was allocated.
     *
     * @param capacity capacity of the new buffer in items
     */
    default void onAllocate(int capacity) {
    }

    /**
     * A uniquely owned buffer changed capacity in place.
     *
     * @param oldCapacity capacity before the change
     * @param newCapacity capacity after the change
     */
    default void onResize(int oldCapacity, int newCapacity) {
    }

    /**
     * The last reference to a buffer was dropped.
     *
     * @param capacity capacity of the released buffer
     */
    default void onRelease(int capacity) {
    }
}
