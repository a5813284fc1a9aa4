package io.tessera.sequence;

import io.tessera.core.RefCounting;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reference count of a shared buffer. A new count starts at one.
 */
abstract class RefCount {

    static RefCount create(RefCounting mode) {
        return mode == RefCounting.ATOMIC ? new Atomic() : new Plain();
    }

    abstract int get();

    abstract void increment();

    /**
     * @return the count after decrementing
     */
    abstract int decrement();

    private static final class Plain extends RefCount {
        private int count = 1;

        @Override
        int get() {
            return count;
        }

        @Override
        void increment() {
            count++;
        }

        @Override
        int decrement() {
            return --count;
        }
    }

    private static final class Atomic extends RefCount {
        private final AtomicInteger count = new AtomicInteger(1);

        @Override
        int get() {
            return count.get();
        }

        @Override
        void increment() {
            count.incrementAndGet();
        }

        @Override
        int decrement() {
            return count.decrementAndGet();
        }
    }
}
