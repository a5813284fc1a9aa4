package io.tessera.sequence;

import io.tessera.core.ContainerConfiguration;
import io.tessera.core.RefCounting;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;

class SequenceSharingTest {

    @Test
    void appendToSharedViewLeavesOriginalUntouched() {
        var first = Sequence.of(1, 2, 3);
        var second = new Sequence<>(first);

        second.append(4);

        assertThat(first).containsExactly(1, 2, 3);
        assertThat(second).containsExactly(1, 2, 3, 4);
        assertThat(first.isShared()).isFalse();
        assertThat(second.isShared()).isFalse();
    }

    @Test
    void copyingViewSharesBuffer() {
        var first = Sequence.of("a", "b");
        var second = new Sequence<>(first);

        assertThat(first.isShared()).isTrue();
        assertThat(second.bufferRefs()).isEqualTo(2);
        assertThat(second.capacity()).isEqualTo(first.capacity());
    }

    @Test
    void setDetachesOnlyTheWriter() {
        var first = Sequence.of(1, 2, 3);
        var second = new Sequence<Integer>().reference(first);

        second.set(0, 9);

        assertThat(first).containsExactly(1, 2, 3);
        assertThat(second).containsExactly(9, 2, 3);
    }

    @Test
    void getMutableCopiesItemsBeforeHandingThemOut() {
        var config = ContainerConfiguration.defaults();
        var first = new Sequence<StringBuilder>(config, sb -> new StringBuilder(sb));
        first.append(new StringBuilder("x"));
        var second = new Sequence<>(first);

        second.getMutable(0).append("y");

        assertThat(first.get(0)).hasToString("x");
        assertThat(second.get(0)).hasToString("xy");
    }

    @Test
    void emptySliceAtEndDoesNotLeakHiddenItems() {
        var sequence = Sequence.of(1, 2, 3);

        sequence.slice(3);
        sequence.append(7);
        sequence.append(8);

        assertThat(sequence).containsExactly(7, 8);
    }

    @Test
    void emptySliceOfSharedViewDoesNotLeakHiddenItems() {
        var original = Sequence.of(1, 2, 3);
        var sequence = new Sequence<>(original);

        sequence.slice(3);
        sequence.append(7, 8);

        assertThat(sequence).containsExactly(7, 8);
        assertThat(original).containsExactly(1, 2, 3);
    }

    @Test
    void unsliceDropsHiddenItemsInPlace() {
        var sequence = Sequence.of(1, 2, 3, 4, 5, 6);

        sequence.slice(2, 2);

        assertThat(sequence).containsExactly(3, 4);
        assertThat(sequence.bufferUsed()).isEqualTo(6);

        sequence.unslice();

        assertThat(sequence).containsExactly(3, 4);
        assertThat(sequence.bufferUsed()).isEqualTo(2);
        assertThat(sequence.offset()).isZero();
        assertThat(sequence.capacity()).isEqualTo(8);
    }

    @Test
    void unsliceOfSharedViewDetachesTightBuffer() {
        var original = Sequence.of(1, 2, 3, 4, 5, 6);
        var view = new Sequence<>(original).slice(1, 2);

        view.unslice();

        assertThat(view).containsExactly(2, 3);
        assertThat(view.capacity()).isEqualTo(2);
        assertThat(original.isShared()).isFalse();
        assertThat(original).containsExactly(1, 2, 3, 4, 5, 6);
    }

    @Test
    void appendReallocatesLogarithmically() {
        var observer = new CountingObserver();
        var config = ContainerConfiguration.builder().allocationObserver(observer).build();
        var sequence = new Sequence<Integer>(config);

        for (var i = 0; i < 1000; i++) {
            sequence.append(i);
        }

        assertThat(sequence.size()).isEqualTo(1000);
        assertThat(sequence.get(999)).isEqualTo(999);
        assertThat(observer.reallocations()).isLessThanOrEqualTo(10);
    }

    @Test
    void clearedBufferIsReusedByNextWrite() {
        var observer = new CountingObserver();
        var config = ContainerConfiguration.builder().allocationObserver(observer).build();
        var sequence = new Sequence<String>(config);
        sequence.append("a", "b", "c");

        sequence.clear();

        assertThat(sequence.state()).isEqualTo(Storage.EMPTY);
        assertThat(sequence.capacity()).isEqualTo(8);

        sequence.append("x");

        assertThat(sequence).containsExactly("x");
        assertThat(observer.allocations).isEqualTo(1);
        assertThat(observer.releases).isZero();
    }

    @Test
    void setNullKeepsUniqueBuffer() {
        var sequence = Sequence.of("a", "b");

        sequence.setNull();

        assertThat(sequence.isNull()).isTrue();
        assertThat(sequence.capacity()).isEqualTo(8);
        assertThat(sequence.bufferUsed()).isZero();
    }

    @Test
    void clearOfSharedViewReleasesReference() {
        var first = Sequence.of("a", "b");
        var second = new Sequence<>(first);

        second.clear();

        assertThat(second.capacity()).isZero();
        assertThat(first.isShared()).isFalse();
        assertThat(first).containsExactly("a", "b");
    }

    @Test
    void externalReferenceCopiesOnWrite() {
        String[] data = {"a", "b", "c"};
        var sequence = Sequence.wrap(data);

        assertThat(sequence.state()).isEqualTo(Storage.EXTERNAL);
        assertThat(sequence.capacity()).isZero();
        assertThat(sequence.get(1)).isEqualTo("b");

        sequence.set(1, "z");

        assertThat(data).containsExactly("a", "b", "c");
        assertThat(sequence).containsExactly("a", "z", "c");
        assertThat(sequence.state()).isEqualTo(Storage.BUFFERED);
    }

    @Test
    void externalReferenceKeepsLazyBufferForLaterWrites() {
        var observer = new CountingObserver();
        var config = ContainerConfiguration.builder().allocationObserver(observer).build();
        var sequence = new Sequence<String>(config);
        sequence.append("a", "b");
        String[] data = {"x", "y", "z"};

        sequence.reference(data, 0, 3);

        assertThat(sequence.state()).isEqualTo(Storage.EXTERNAL);
        assertThat(sequence.capacity()).isEqualTo(8);

        sequence.append("w");

        assertThat(sequence).containsExactly("x", "y", "z", "w");
        assertThat(observer.allocations).isEqualTo(1);
    }

    @Test
    void wrapRangeViewsPartOfArray() {
        Integer[] data = {1, 2, 3, 4};

        assertThat(Sequence.wrap(data, 1, 2)).containsExactly(2, 3);
    }

    @Test
    void popAndPopqDoNotCopySharedBuffer() {
        var first = Sequence.of(1, 2, 3);
        var second = new Sequence<>(first);

        assertThat(second.pop()).isEqualTo(3);
        assertThat(second.popq()).isEqualTo(1);

        assertThat(second).containsExactly(2);
        assertThat(second.isShared()).isTrue();
        assertThat(first).containsExactly(1, 2, 3);
    }

    @Test
    void reserveMakesViewUnique() {
        var first = Sequence.of(1, 2, 3);
        var second = new Sequence<>(first);

        second.reserve(20);

        assertThat(second.isShared()).isFalse();
        assertThat(second.capacity()).isGreaterThanOrEqualTo(23);
        assertThat(second).containsExactly(1, 2, 3);
        assertThat(first.isShared()).isFalse();
    }

    @Test
    void reserveOnNullViewAllocatesEmptyBuffer() {
        var sequence = new Sequence<String>();

        sequence.reserve(5);

        assertThat(sequence.isEmpty()).isTrue();
        assertThat(sequence.isNull()).isFalse();
        assertThat(sequence.capacity()).isEqualTo(8);
    }

    @Test
    void moveRelocatesItemsFromUniqueSource() {
        var copies = new AtomicInteger();
        UnaryOperator<String> copier = item -> {
            copies.incrementAndGet();
            return item;
        };
        var config = ContainerConfiguration.defaults();
        var source = new Sequence<String>(config, copier);
        source.append("a", "b", "c", "d");
        var target = new Sequence<String>(config, copier);
        target.append("x");

        var moved = target.move(1, source, 1, 2);

        assertThat(moved).isEqualTo(2);
        assertThat(target).containsExactly("x", "b", "c");
        assertThat(source).containsExactly("a", "d");
        assertThat(copies).hasValue(0);
    }

    @Test
    void moveCopiesItemsFromSharedSource() {
        var copies = new AtomicInteger();
        UnaryOperator<String> copier = item -> {
            copies.incrementAndGet();
            return item;
        };
        var config = ContainerConfiguration.defaults();
        var source = new Sequence<String>(config, copier);
        source.append("a", "b", "c", "d");
        var keeper = new Sequence<>(source);
        var target = new Sequence<String>(config, copier);

        target.move(0, source, 0, 2);

        assertThat(target).containsExactly("a", "b");
        assertThat(source).containsExactly("c", "d");
        assertThat(keeper).containsExactly("a", "b", "c", "d");
        assertThat(copies.get()).isPositive();
    }

    @Test
    void moveFromItselfIsIgnored() {
        var sequence = Sequence.of(1, 2, 3);

        assertThat(sequence.move(0, sequence, 1, 1)).isZero();
        assertThat(sequence).containsExactly(1, 2, 3);
    }

    @Test
    void copyFromSequenceAppliesCopier() {
        var copies = new AtomicInteger();
        var source = Sequence.of("a", "b", "c");
        var target = new Sequence<String>(ContainerConfiguration.defaults(), item -> {
            copies.incrementAndGet();
            return item;
        });

        target.copy(source);

        assertThat(target).containsExactly("a", "b", "c");
        assertThat(target.isShared()).isFalse();
        assertThat(copies).hasValue(3);
    }

    @Test
    void atomicRefCountsGiveSameIsolation() {
        var config = ContainerConfiguration.builder().refCounting(RefCounting.ATOMIC).build();
        var first = new Sequence<Integer>(config);
        first.append(1, 2);
        var second = new Sequence<>(first);

        second.prepend(0);

        assertThat(first).containsExactly(1, 2);
        assertThat(second).containsExactly(0, 1, 2);
    }

    @Test
    void unshareOfExternalViewBuffersItems() {
        Integer[] data = {1, 2};
        var sequence = Sequence.wrap(data);

        sequence.unshare();

        assertThat(sequence.state()).isEqualTo(Storage.BUFFERED);
        assertThat(sequence).containsExactly(1, 2);
    }
}
