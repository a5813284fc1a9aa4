package io.tessera.sequence;

import io.tessera.core.AllocationObserver;
import io.tessera.core.ContainerConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Reference-counted item storage backing one or more {@link Sequence} views.
 * <p>
 * Slots {@code [0, used)} hold live items, slots past {@code used} are always
 * {@code null}. Only a uniquely owned buffer may be written or resized.
 */
final class SharedBuffer {
    private static final Logger log = LoggerFactory.getLogger(SharedBuffer.class);

    private final RefCount refs;
    private final AllocationObserver observer;
    Object[] items;
    int used;

    private SharedBuffer(int capacity, ContainerConfiguration configuration) {
        this.items = new Object[capacity];
        this.refs = RefCount.create(configuration.refCounting());
        this.observer = configuration.allocationObserver();
    }

    static SharedBuffer allocate(int capacity, ContainerConfiguration configuration) {
        assert capacity > 0;
        var buffer = new SharedBuffer(capacity, configuration);
        if (log.isTraceEnabled()) {
            log.trace("Allocated buffer with capacity {}", capacity);
        }
        buffer.observer.onAllocate(capacity);
        return buffer;
    }

    int capacity() {
        return items.length;
    }

    int refs() {
        return refs.get();
    }

    boolean isShared() {
        return refs.get() > 1;
    }

    void retain() {
        refs.increment();
    }

    /**
     * Drop one reference, clearing the items when it was the last one.
     *
     * @return true if the buffer is no longer referenced
     */
    boolean release() {
        if (refs.decrement() > 0) {
            return false;
        }
        destruct(0, used);
        used = 0;
        observer.onRelease(items.length);
        return true;
    }

    /**
     * Change capacity of a uniquely owned buffer. Items past the new capacity
     * must already be destructed.
     */
    void resize(int capacity) {
        assert refs.get() == 1;
        assert used <= capacity;
        var old = items.length;
        if (old == capacity) {
            return;
        }
        items = Arrays.copyOf(items, capacity);
        if (log.isTraceEnabled()) {
            log.trace("Resized buffer from {} to {}", old, capacity);
        }
        observer.onResize(old, capacity);
    }

    void destruct(int from, int to) {
        if (from < to) {
            Arrays.fill(items, from, to, null);
        }
    }
}
