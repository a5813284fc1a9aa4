package io.tessera.sequence;

import io.tessera.core.ContainerConfiguration;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Copy-on-write view over a sequence of items.
 * <p>
 * A view is a window {@code (offset, length)} into either a reference-counted
 * {@link SharedBuffer} or a caller-owned array. Copying a view shares its
 * buffer in O(1); the first write through any sharer detaches that sharer onto
 * a private buffer, so writes are never observable through other views.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>Every mutator calls {@link #unshare()} semantics first; reads never copy.</li>
 *   <li>Slicing only moves the window. Hidden items stay in the buffer until the
 *       next write or {@link #unslice()}.</li>
 *   <li>A buffer emptied by {@link #clear()} is kept detached and reused by the
 *       next write that fits in it.</li>
 *   <li>Items copied out of another view's storage go through the configured
 *       copier; items handed in directly are stored as given.</li>
 *   <li>Out-of-range direct access is a programmer error checked only by
 *       assertions. Lookups report {@link #NOT_FOUND} or {@code false}.</li>
 * </ul>
 * <p>
 * Not thread-safe. Two views sharing a buffer must be confined to one thread or
 * externally synchronized, since a write through either one touches the shared
 * reference count.
 *
 * @param <T> item type
 */
public final class Sequence<T> implements Iterable<T> {

    /** Index returned by searches that find nothing. */
    public static final int NOT_FOUND = -1;

    private final ContainerConfiguration configuration;
    private final UnaryOperator<T> copier;

    private Storage storage = Storage.NULL;
    // BUFFERED: holds the items. Otherwise a detached, unshared, empty buffer kept for reuse.
    private SharedBuffer buffer;
    private Object[] external;
    private int offset;
    private int length;

    public Sequence() {
        this(ContainerConfiguration.defaults(), UnaryOperator.identity());
    }

    public Sequence(ContainerConfiguration configuration) {
        this(configuration, UnaryOperator.identity());
    }

    /**
     * @param configuration buffer tuning
     * @param copier        copies an item into a new buffer; identity for immutable items
     */
    public Sequence(ContainerConfiguration configuration, UnaryOperator<T> copier) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.copier = Objects.requireNonNull(copier, "copier");
    }

    /**
     * Create a view sharing {@code other}'s data.
     */
    public Sequence(Sequence<T> other) {
        this(other.configuration, other.copier);
        reference(other);
    }

    @SafeVarargs
    public static <T> Sequence<T> of(T... items) {
        var sequence = new Sequence<T>();
        sequence.copy(items, 0, items.length);
        return sequence;
    }

    public static <T> Sequence<T> empty() {
        return new Sequence<T>().setEmpty();
    }

    /**
     * View over a caller-owned array without copying it.
     * <p>
     * The array must outlive the view and must not be modified while the view
     * references it. The first write through the view copies the items.
     */
    public static <T> Sequence<T> wrap(T[] data) {
        return new Sequence<T>().reference(data, 0, data.length);
    }

    public static <T> Sequence<T> wrap(T[] data, int from, int count) {
        return new Sequence<T>().reference(data, from, count);
    }

    // ------------------------------------------------------------------ read access

    public Storage state() {
        return storage;
    }

    public boolean isNull() {
        return storage == Storage.NULL;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    public int size() {
        return length;
    }

    /**
     * Capacity of the buffer held by this view, used or detached.
     *
     * @return capacity in items, 0 if no buffer is held
     */
    public int capacity() {
        return buffer == null ? 0 : buffer.capacity();
    }

    /**
     * @return true if another view references the same buffer
     */
    public boolean isShared() {
        return storage == Storage.BUFFERED && buffer.isShared();
    }

    /**
     * Item at {@code index}. Unchecked apart from assertions.
     */
    @SuppressWarnings("unchecked")
    public T get(int index) {
        assert index >= 0 && index < length : "index " + index + " out of bounds for size " + length;
        return (T) array()[offset + index];
    }

    /**
     * @return first item, or null if empty
     */
    public T first() {
        return length == 0 ? null : get(0);
    }

    /**
     * @return last item, or null if empty
     */
    public T last() {
        return length == 0 ? null : get(length - 1);
    }

    public Object[] toArray() {
        return length == 0 ? new Object[0] : Arrays.copyOfRange(array(), offset, offset + length);
    }

    public T[] toArray(T[] target) {
        var result = target.length >= length ? target : Arrays.copyOf(target, length);
        if (length > 0) {
            System.arraycopy(array(), offset, result, 0, length);
        }
        if (result.length > length) {
            result[length] = null;
        }
        return result;
    }

    // ------------------------------------------------------------------ search

    public int find(T item) {
        return find(item, 0, length);
    }

    /**
     * Index of the first item equal to {@code item} within {@code [start, end)}.
     *
     * @return index, or {@link #NOT_FOUND}
     */
    public int find(T item, int start, int end) {
        end = Math.min(end, length);
        var items = array();
        for (var i = Math.max(start, 0); i < end; i++) {
            if (Objects.equals(items[offset + i], item)) {
                return i;
            }
        }
        return NOT_FOUND;
    }

    public int findLast(T item) {
        return findLast(item, 0, length);
    }

    public int findLast(T item, int start, int end) {
        end = Math.min(end, length);
        var items = array();
        for (var i = end - 1; i >= Math.max(start, 0); i--) {
            if (Objects.equals(items[offset + i], item)) {
                return i;
            }
        }
        return NOT_FOUND;
    }

    /**
     * Index of the first item equal to any of {@code candidates}.
     */
    @SafeVarargs
    public final int findAny(T... candidates) {
        return findIf(item -> {
            for (var candidate : candidates) {
                if (Objects.equals(candidate, item)) {
                    return true;
                }
            }
            return false;
        });
    }

    @SuppressWarnings("unchecked")
    public int findIf(Predicate<? super T> predicate) {
        var items = array();
        for (var i = 0; i < length; i++) {
            if (predicate.test((T) items[offset + i])) {
                return i;
            }
        }
        return NOT_FOUND;
    }

    public boolean contains(T item) {
        return find(item) != NOT_FOUND;
    }

    /**
     * @return true if {@code other}'s items occur contiguously in this view
     */
    public boolean contains(Sequence<? extends T> other) {
        if (other.length == 0) {
            return !other.isNull();
        }
        for (var i = 0; i + other.length <= length; i++) {
            if (regionEquals(i, other)) {
                return true;
            }
        }
        return false;
    }

    public boolean startsWith(Sequence<? extends T> prefix) {
        return prefix.length <= length && regionEquals(0, prefix);
    }

    public boolean endsWith(Sequence<? extends T> suffix) {
        return suffix.length <= length && regionEquals(length - suffix.length, suffix);
    }

    /**
     * Lexicographic comparison. A null view orders before any non-null view.
     */
    @SuppressWarnings("unchecked")
    public int compare(Sequence<? extends T> other, Comparator<? super T> comparator) {
        if (isNull() || other.isNull()) {
            return Boolean.compare(!isNull(), !other.isNull());
        }
        var mine = array();
        var theirs = other.array();
        var common = Math.min(length, other.length);
        for (var i = 0; i < common; i++) {
            var cmp = comparator.compare((T) mine[offset + i], (T) theirs[other.offset + i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(length, other.length);
    }

    // ------------------------------------------------------------------ split, slice, trim

    /**
     * Split around the item at {@code index}, which goes to neither side.
     * <p>
     * On a bad index {@code left} references this whole view, {@code right} is
     * set null and false is returned.
     */
    public boolean splitAt(int index, Sequence<T> left, Sequence<T> right) {
        if (index < 0 || index >= length) {
            if (left != null) {
                left.reference(this);
            }
            if (right != null) {
                right.setNull();
            }
            return false;
        }
        if (right != null) {
            right.reference(this, index + 1, length);
        }
        if (left != null) {
            left.reference(this, 0, index);
        }
        return true;
    }

    /**
     * Keep the items before {@code index}; unchanged on a bad index.
     */
    public boolean splitAtKeepLeft(int index) {
        if (index < 0 || index >= length) {
            return false;
        }
        slice(0, index);
        return true;
    }

    /**
     * Keep the items after {@code index}; set null on a bad index.
     */
    public boolean splitAtKeepRight(int index) {
        if (index < 0 || index >= length) {
            setNull();
            return false;
        }
        slice(index + 1);
        return true;
    }

    /**
     * Hide the first {@code index} items. An index past the end leaves an empty
     * view positioned at the end.
     */
    public Sequence<T> slice(int index) {
        if (index > 0) {
            var skip = Math.min(index, length);
            offset += skip;
            length -= skip;
        }
        return this;
    }

    public Sequence<T> slice(int index, int count) {
        slice(index);
        if (count >= 0 && count < length) {
            length = count;
        }
        return this;
    }

    /**
     * Slice to {@code [start, end)}; an end before start gives an empty slice.
     */
    public Sequence<T> slice2(int start, int end) {
        return slice(start, start < end ? end - start : 0);
    }

    public Sequence<T> trimLeft(int count) {
        return slice(count);
    }

    public Sequence<T> trimRight(int count) {
        if (count > 0) {
            length -= Math.min(count, length);
        }
        return this;
    }

    public Sequence<T> truncate(int size) {
        if (size >= 0 && size < length) {
            length = size;
        }
        return this;
    }

    /**
     * Drop items hidden by slicing. A shared view detaches onto a tight private
     * buffer holding only its visible items.
     */
    public Sequence<T> unslice() {
        if (storage == Storage.BUFFERED && buffer.used > length) {
            if (buffer.isShared()) {
                if (length > 0) {
                    rebind(length, length, 0, 0);
                } else {
                    dropBuffer();
                    storage = Storage.EMPTY;
                    offset = 0;
                }
            } else {
                unsliceBuffer();
            }
        }
        return this;
    }

    // ------------------------------------------------------------------ set, reference, copy

    /**
     * Release all items and become null. A uniquely held buffer is kept for reuse.
     */
    public Sequence<T> setNull() {
        detach();
        storage = Storage.NULL;
        return this;
    }

    public Sequence<T> setEmpty() {
        detach();
        storage = Storage.EMPTY;
        return this;
    }

    /**
     * Remove all items. A null view stays null; a uniquely held buffer is kept
     * detached so the next write can reuse it.
     */
    public Sequence<T> clear() {
        if (storage != Storage.NULL) {
            setEmpty();
        }
        return this;
    }

    /**
     * Share {@code other}'s data. Buffered data gains a reference; external data
     * is aliased and stays the caller's responsibility.
     */
    public Sequence<T> reference(Sequence<T> other) {
        return other == this ? this : reference(other, 0, other.length);
    }

    /**
     * Share a sub-range of {@code other}'s data.
     */
    public Sequence<T> reference(Sequence<T> other, int index, int count) {
        if (other.isNull()) {
            return setNull();
        }
        if (index < 0 || index >= other.length) {
            return setEmpty();
        }
        count = Math.min(count, other.length - index);
        if (count <= 0) {
            return setEmpty();
        }
        if (other.storage == Storage.EXTERNAL) {
            var data = other.external;
            var from = other.offset + index;
            detach();
            bindExternal(data, from, count);
            return this;
        }
        var shared = other.buffer;
        var from = other.offset + index;
        shared.retain();
        dropBuffer();
        buffer = shared;
        external = null;
        storage = Storage.BUFFERED;
        offset = from;
        length = count;
        return this;
    }

    /**
     * Alias a caller-owned array without copying.
     */
    public Sequence<T> reference(T[] data, int from, int count) {
        if (data == null) {
            return setNull();
        }
        if (count <= 0) {
            return setEmpty();
        }
        assert from >= 0 && from + count <= data.length;
        detach();
        bindExternal(data, from, count);
        return this;
    }

    /**
     * Replace contents with a private copy of {@code data[from, from + count)}.
     */
    public Sequence<T> copy(T[] data, int from, int count) {
        if (data == null) {
            return setNull();
        }
        if (count <= 0) {
            return setEmpty();
        }
        setEmpty();
        var at = openGap(0, count);
        copyItems(data, from, buffer.items, at, count);
        return this;
    }

    /**
     * Replace contents with a private copy of {@code other}'s items.
     */
    public Sequence<T> copy(Sequence<T> other) {
        if (other == this) {
            return unshare();
        }
        if (other.isNull()) {
            return setNull();
        }
        if (other.length == 0) {
            return setEmpty();
        }
        var source = other.array();
        var from = other.offset;
        var count = other.length;
        setEmpty();
        var at = openGap(0, count);
        copyItems(source, from, buffer.items, at, count);
        return this;
    }

    // ------------------------------------------------------------------ capacity

    /**
     * Make this view the sole owner of its items. No-op when already unique or
     * when there are no items.
     */
    public Sequence<T> unshare() {
        switch (storage) {
            case BUFFERED -> {
                if (buffer.isShared()) {
                    if (length > 0) {
                        rebind(configuration.initialCapacity(length), length, 0, 0);
                    } else {
                        dropBuffer();
                        storage = Storage.EMPTY;
                        offset = 0;
                    }
                }
            }
            case EXTERNAL -> rebind(configuration.initialCapacity(length), length, 0, 0);
            default -> {
            }
        }
        return this;
    }

    /**
     * Set buffer capacity exactly. Items that don't fit are removed. A view
     * without a buffer gets a detached one and keeps referencing its data.
     */
    public Sequence<T> setCapacity(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be non-negative");
        }
        if (storage == Storage.BUFFERED) {
            if (capacity == 0) {
                dropBuffer();
                storage = Storage.EMPTY;
                offset = 0;
                length = 0;
            } else if (buffer.isShared()) {
                length = Math.min(length, capacity);
                rebind(capacity, length, 0, 0);
            } else if (capacity != buffer.capacity()) {
                unsliceBuffer();
                if (capacity < length) {
                    buffer.destruct(capacity, length);
                    buffer.used = capacity;
                    length = capacity;
                }
                buffer.resize(capacity);
            }
            return this;
        }
        if (length > capacity) {
            length = capacity;
            if (length == 0) {
                external = null;
                offset = 0;
                storage = Storage.EMPTY;
            }
        }
        if (buffer != null) {
            if (capacity == 0) {
                dropBuffer();
            } else {
                buffer.resize(capacity);
            }
        } else if (capacity > 0) {
            buffer = SharedBuffer.allocate(capacity, configuration);
        }
        return this;
    }

    public Sequence<T> capacityMin(int min) {
        if (buffer == null) {
            setCapacity(Math.max(length, min));
        } else if (min > buffer.capacity()) {
            setCapacity(min);
        }
        return this;
    }

    public Sequence<T> capacityMax(int max) {
        if (buffer != null && buffer.capacity() > max) {
            setCapacity(max);
        } else {
            truncate(max);
        }
        return this;
    }

    /**
     * Shrink capacity to the current size. Ignored while shared.
     */
    public Sequence<T> compact() {
        if (buffer != null && !isShared() && buffer.capacity() > length) {
            setCapacity(length);
        }
        return this;
    }

    /**
     * Make this view unique and writable with room for {@code extra} more items.
     */
    public Sequence<T> reserve(int extra) {
        var needed = length + Math.max(extra, 0);
        if (storage == Storage.BUFFERED && !buffer.isShared()) {
            if (needed > buffer.capacity()) {
                unsliceBuffer();
                buffer.resize(needed);
            }
            return this;
        }
        if (needed == 0 && storage != Storage.BUFFERED) {
            return this;
        }
        if (buffer != null && storage != Storage.BUFFERED && buffer.capacity() < needed) {
            dropBuffer();
        }
        rebind(configuration.initialCapacity(needed), length, 0, 0);
        return this;
    }

    /**
     * Grow with null items or shrink from the end until the size is {@code size}.
     */
    public Sequence<T> resize(int size) {
        if (size <= 0) {
            clear();
            setCapacity(0);
        } else if (size < length) {
            remove(size, length - size);
        } else if (size > length) {
            openGap(length, size - length);
        } else {
            unshare();
        }
        return this;
    }

    // ------------------------------------------------------------------ write access

    public Sequence<T> set(int index, T item) {
        assert index >= 0 && index < length : "index " + index + " out of bounds for size " + length;
        unshare();
        buffer.items[offset + index] = item;
        return this;
    }

    /**
     * Item at {@code index} after unsharing, so in-place changes to a mutable
     * item are private to this view.
     */
    @SuppressWarnings("unchecked")
    public T getMutable(int index) {
        assert index >= 0 && index < length : "index " + index + " out of bounds for size " + length;
        unshare();
        return (T) buffer.items[offset + index];
    }

    /**
     * Fill {@code count} slots from {@code index} with copies of {@code item},
     * growing as needed. An index past the end appends.
     */
    public Sequence<T> fill(T item, int index, int count) {
        index = Math.min(Math.max(index, 0), length);
        if (count <= 0) {
            return this;
        }
        var end = index + count;
        if (end > length) {
            openGap(length, end - length);
        } else {
            unshare();
        }
        var items = buffer.items;
        for (var i = index; i < end; i++) {
            items[offset + i] = copier.apply(item);
        }
        return this;
    }

    public Sequence<T> append(T item) {
        var at = openGap(length, 1);
        buffer.items[at] = item;
        return this;
    }

    @SafeVarargs
    public final Sequence<T> append(T... items) {
        return append(items, 0, items.length);
    }

    public Sequence<T> append(T[] items, int from, int count) {
        insert(length, items, from, count);
        return this;
    }

    public Sequence<T> append(Sequence<? extends T> other) {
        insert(length, other);
        return this;
    }

    public Sequence<T> prepend(T item) {
        var at = openGap(0, 1);
        buffer.items[at] = item;
        return this;
    }

    @SafeVarargs
    public final Sequence<T> prepend(T... items) {
        insert(0, items, 0, items.length);
        return this;
    }

    public Sequence<T> prepend(Sequence<? extends T> other) {
        insert(0, other);
        return this;
    }

    /**
     * Insert one item. An index past the end appends.
     *
     * @return index the item was inserted at
     */
    public int insert(int index, T item) {
        index = Math.min(Math.max(index, 0), length);
        var at = openGap(index, 1);
        buffer.items[at] = item;
        return index;
    }

    public int insert(int index, T[] items, int from, int count) {
        index = Math.min(Math.max(index, 0), length);
        if (count <= 0) {
            ensureNotNull();
            return index;
        }
        var at = openGap(index, count);
        System.arraycopy(items, from, buffer.items, at, count);
        return index;
    }

    /**
     * Insert copies of {@code other}'s items.
     *
     * @return index the items were inserted at
     */
    public int insert(int index, Sequence<? extends T> other) {
        index = Math.min(Math.max(index, 0), length);
        var count = other.length;
        if (count == 0) {
            ensureNotNull();
            return index;
        }
        Object[] source;
        int from;
        if (other == this) {
            source = toArray();
            from = 0;
        } else {
            source = other.array();
            from = other.offset;
        }
        var at = openGap(index, count);
        copyItems(source, from, buffer.items, at, count);
        return index;
    }

    /**
     * Remove {@code count} items starting at {@code index}. Head removal
     * advances the window and tail removal shrinks it; interior removal shifts
     * the smaller side.
     *
     * @return number of items removed, 0 for a bad index
     */
    public int remove(int index, int count) {
        if (index < 0 || index >= length || count <= 0) {
            return 0;
        }
        count = Math.min(count, length - index);
        if (count == length) {
            clear();
            return count;
        }
        if (storage != Storage.BUFFERED || buffer.isShared()) {
            rebind(configuration.initialCapacity(length - count), index, 0, count);
            return count;
        }
        trimHiddenTail();
        var items = buffer.items;
        var back = length - index - count;
        if (index < back) {
            System.arraycopy(items, offset, items, offset + count, index);
            buffer.destruct(offset, offset + count);
            offset += count;
        } else {
            System.arraycopy(items, offset + index + count, items, offset + index, back);
            buffer.destruct(offset + length - count, offset + length);
            buffer.used -= count;
        }
        length -= count;
        return count;
    }

    public int remove(int index) {
        return remove(index, 1);
    }

    /**
     * Remove and return the item at {@code index}.
     *
     * @return removed item, or null for a bad index
     */
    public T pop(int index) {
        if (index < 0 || index >= length) {
            return null;
        }
        var item = get(index);
        remove(index, 1);
        return item;
    }

    /**
     * Slice off and return the last item (stack order). O(1) and never copies;
     * the item stays hidden in a shared buffer until the next write.
     *
     * @return last item, or null if empty
     */
    public T pop() {
        if (length == 0) {
            return null;
        }
        var item = get(length - 1);
        length--;
        return item;
    }

    /**
     * Slice off and return the first item (queue order). O(1) and never copies.
     *
     * @return first item, or null if empty
     */
    public T popq() {
        if (length == 0) {
            return null;
        }
        var item = get(0);
        offset++;
        length--;
        return item;
    }

    /**
     * Replace {@code removeCount} items at {@code index} with {@code items}.
     */
    @SafeVarargs
    public final Sequence<T> replace(int index, int removeCount, T... items) {
        if (removeCount <= 0) {
            insert(index, items, 0, items.length);
        } else if (items.length == 0) {
            remove(index, removeCount);
        } else if (index >= length) {
            append(items, 0, items.length);
        } else {
            removeCount = Math.min(removeCount, length - index);
            if (storage == Storage.BUFFERED && !buffer.isShared()) {
                remove(index, removeCount);
                insert(index, items, 0, items.length);
            } else {
                var newLength = length - removeCount + items.length;
                rebind(configuration.initialCapacity(newLength), index, items.length, removeCount);
                System.arraycopy(items, 0, buffer.items, index, items.length);
            }
        }
        return this;
    }

    /**
     * Move the item at {@code index} to {@code dest}, shifting items in between.
     */
    public void move(int dest, int index) {
        if (index < 0 || index >= length) {
            return;
        }
        dest = Math.min(Math.max(dest, 0), length - 1);
        if (dest == index) {
            return;
        }
        unshare();
        var items = buffer.items;
        var item = items[offset + index];
        if (index > dest) {
            System.arraycopy(items, offset + dest, items, offset + dest + 1, index - dest);
        } else {
            System.arraycopy(items, offset + index + 1, items, offset + index, dest - index);
        }
        items[offset + dest] = item;
    }

    /**
     * Transplant {@code count} items from {@code src} into this view at
     * {@code dest}. Items are relocated when {@code src} uniquely owns its
     * buffer, otherwise copied and then removed from {@code src}.
     *
     * @return number of items moved
     */
    public int move(int dest, Sequence<T> src, int srcIndex, int count) {
        if (src == this || srcIndex < 0 || srcIndex >= src.length) {
            return 0;
        }
        count = Math.min(count, src.length - srcIndex);
        if (count <= 0) {
            return 0;
        }
        dest = Math.min(Math.max(dest, 0), length);
        var at = openGap(dest, count);
        var from = src.offset + srcIndex;
        if (src.storage == Storage.BUFFERED && !src.buffer.isShared()) {
            System.arraycopy(src.buffer.items, from, buffer.items, at, count);
        } else {
            copyItems(src.array(), from, buffer.items, at, count);
        }
        src.remove(srcIndex, count);
        return count;
    }

    public void swap(int index1, int index2) {
        if (index1 != index2 && index1 >= 0 && index2 >= 0 && index1 < length && index2 < length) {
            unshare();
            var items = buffer.items;
            var temp = items[offset + index1];
            items[offset + index1] = items[offset + index2];
            items[offset + index2] = temp;
        }
    }

    public Sequence<T> reverse() {
        if (length > 1) {
            unshare();
            var items = buffer.items;
            for (int left = offset, right = offset + length - 1; left < right; left++, right--) {
                var temp = items[left];
                items[left] = items[right];
                items[right] = temp;
            }
        }
        return this;
    }

    // ------------------------------------------------------------------ object

    @Override
    public Iterator<T> iterator() {
        var items = array();
        var start = offset;
        var end = offset + length;
        return new Iterator<>() {
            private int position = start;

            @Override
            public boolean hasNext() {
                return position < end;
            }

            @Override
            @SuppressWarnings("unchecked")
            public T next() {
                if (position >= end) {
                    throw new NoSuchElementException();
                }
                return (T) items[position++];
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Sequence<?> other)) {
            return false;
        }
        if (isNull() || other.isNull()) {
            return isNull() && other.isNull();
        }
        if (length != other.length) {
            return false;
        }
        var mine = array();
        var theirs = other.array();
        if (mine == theirs && offset == other.offset) {
            return true;
        }
        for (var i = 0; i < length; i++) {
            if (!Objects.equals(mine[offset + i], theirs[other.offset + i])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        if (isNull()) {
            return 0;
        }
        var items = array();
        var hash = 1;
        for (var i = 0; i < length; i++) {
            hash = 31 * hash + Objects.hashCode(items[offset + i]);
        }
        return hash;
    }

    @Override
    public String toString() {
        if (isNull()) {
            return "null";
        }
        var sb = new StringBuilder("[");
        var items = array();
        for (var i = 0; i < length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(items[offset + i]);
        }
        return sb.append(']').toString();
    }

    // ------------------------------------------------------------------ diagnostics

    int bufferUsed() {
        return buffer == null ? 0 : buffer.used;
    }

    int bufferRefs() {
        return buffer == null ? 0 : buffer.refs();
    }

    int offset() {
        return offset;
    }

    // ------------------------------------------------------------------ internals

    private Object[] array() {
        return storage == Storage.BUFFERED ? buffer.items : external;
    }

    private void ensureNotNull() {
        if (storage == Storage.NULL) {
            storage = Storage.EMPTY;
        }
    }

    private void bindExternal(Object[] data, int from, int count) {
        external = data;
        offset = from;
        length = count;
        storage = Storage.EXTERNAL;
    }

    /**
     * Let go of the current items. A shared buffer loses our reference, a unique
     * one is emptied and kept detached for reuse.
     */
    private void detach() {
        if (storage == Storage.BUFFERED) {
            if (buffer.isShared()) {
                buffer.release();
                buffer = null;
            } else {
                buffer.destruct(0, buffer.used);
                buffer.used = 0;
            }
        }
        external = null;
        offset = 0;
        length = 0;
    }

    private void dropBuffer() {
        if (buffer != null) {
            buffer.release();
            buffer = null;
        }
    }

    private void trimHiddenTail() {
        var end = offset + length;
        buffer.destruct(end, buffer.used);
        buffer.used = end;
    }

    private void unsliceBuffer() {
        trimHiddenTail();
        if (offset > 0) {
            var items = buffer.items;
            System.arraycopy(items, offset, items, 0, length);
            buffer.destruct(length, offset + length);
            buffer.used = length;
            offset = 0;
        }
    }

    /**
     * Open {@code count} null slots before visible position {@code index},
     * leaving this view unique and buffered.
     *
     * @return absolute buffer position of the first new slot
     */
    private int openGap(int index, int count) {
        assert index >= 0 && index <= length && count > 0;
        var newLength = length + count;
        if (storage == Storage.BUFFERED && !buffer.isShared()) {
            trimHiddenTail();
            var items = buffer.items;
            var capacity = buffer.capacity();
            var tailRoom = capacity - offset - length;
            var back = length - index;
            if (offset >= count && (index <= back || tailRoom < count)) {
                // shift the front part into the hidden head
                System.arraycopy(items, offset, items, offset - count, index);
                offset -= count;
                Arrays.fill(items, offset + index, offset + index + count, null);
            } else if (tailRoom >= count) {
                System.arraycopy(items, offset + index, items, offset + index + count, back);
                Arrays.fill(items, offset + index, offset + index + Math.min(count, back), null);
                buffer.used += count;
            } else if (newLength <= capacity) {
                // compact to the buffer start, opening the gap on the way
                System.arraycopy(items, offset, items, 0, index);
                System.arraycopy(items, offset + index, items, index + count, back);
                Arrays.fill(items, index, index + count, null);
                buffer.used = newLength;
                offset = 0;
            } else {
                rebind(configuration.grownCapacity(capacity, newLength), index, count, 0);
            }
        } else {
            rebind(configuration.initialCapacity(newLength), index, count, 0);
        }
        length = newLength;
        return offset + index;
    }

    /**
     * Move the visible items onto a private buffer at offset 0, skipping
     * {@code removeCount} items at {@code at} and leaving {@code insertCount}
     * null slots there.
     */
    private void rebind(int capacity, int at, int insertCount, int removeCount) {
        var source = array();
        var start = offset;
        var newLength = length - removeCount + insertCount;
        var relocate = storage == Storage.BUFFERED && !buffer.isShared();
        SharedBuffer target;
        if (buffer != null && storage != Storage.BUFFERED && buffer.capacity() >= newLength) {
            target = buffer;
        } else {
            target = SharedBuffer.allocate(Math.max(capacity, Math.max(newLength, 1)), configuration);
        }
        var back = at + removeCount;
        transfer(source, start, target.items, 0, at, relocate);
        transfer(source, start + back, target.items, at + insertCount, length - back, relocate);
        target.used = newLength;
        if (target != buffer) {
            dropBuffer();
        }
        buffer = target;
        external = null;
        storage = Storage.BUFFERED;
        offset = 0;
        length = newLength;
    }

    private void transfer(Object[] source, int from, Object[] target, int to, int count, boolean relocate) {
        if (count <= 0) {
            return;
        }
        if (relocate) {
            System.arraycopy(source, from, target, to, count);
        } else {
            copyItems(source, from, target, to, count);
        }
    }

    @SuppressWarnings("unchecked")
    private void copyItems(Object[] source, int from, Object[] target, int to, int count) {
        for (var i = 0; i < count; i++) {
            target[to + i] = copier.apply((T) source[from + i]);
        }
    }

    private boolean regionEquals(int start, Sequence<? extends T> other) {
        var mine = array();
        var theirs = other.array();
        for (var i = 0; i < other.length; i++) {
            if (!Objects.equals(mine[offset + start + i], theirs[other.offset + i])) {
                return false;
            }
        }
        return true;
    }
}
