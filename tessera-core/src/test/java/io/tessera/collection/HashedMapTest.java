package io.tessera.collection;

import io.tessera.core.ContainerConfiguration;
import io.tessera.table.Direction;
import org.junit.jupiter.api.Test;

import java.util.Comparator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HashedMapTest {

    private record Point(int x, int y) {
    }

    private static HashedMap<Integer, String> collidingMap() {
        return new HashedMap<Integer, String>(Comparator.naturalOrder(), key -> 0, ContainerConfiguration.defaults());
    }

    @Test
    void putAndGet() {
        var map = new HashedMap<String, Integer>();

        assertThat(map.put("a", 1)).isNull();
        assertThat(map.put("a", 2)).isEqualTo(1);

        assertThat(map.get("a")).isEqualTo(2);
        assertThat(map.get("b")).isNull();
        assertThat(map.getOrDefault("b", 7)).isEqualTo(7);
        assertThat(map.size()).isEqualTo(1);
    }

    @Test
    void addRespectsUpdateFlag() {
        var map = new HashedMap<String, Integer>();

        assertThat(map.add("a", 1, false)).isTrue();
        assertThat(map.add("a", 2, false)).isFalse();
        assertThat(map.get("a")).isEqualTo(1);

        assertThat(map.add("a", 3, true)).isFalse();
        assertThat(map.get("a")).isEqualTo(3);
    }

    @Test
    void containsChecksKeyAndValue() {
        var map = new HashedMap<String, Integer>();
        map.put("a", 1);
        map.put("n", null);

        assertThat(map.containsKey("a")).isTrue();
        assertThat(map.contains("a", 1)).isTrue();
        assertThat(map.contains("a", 2)).isFalse();
        assertThat(map.contains("n", null)).isTrue();
        assertThat(map.containsKey("z")).isFalse();
    }

    @Test
    void getOrCreateReturnsWritableEntry() {
        var map = new HashedMap<String, Integer>();

        map.getOrCreate("a").setValue(5);

        assertThat(map.find("a").value()).isEqualTo(5);
    }

    @Test
    void removingInlineEntryKeepsCollidingKeys() {
        var map = collidingMap();
        map.put(1, "one");
        map.put(2, "two");
        map.put(3, "three");

        assertThat(map.remove(1)).isTrue();

        assertThat(map.get(2)).isEqualTo("two");
        assertThat(map.get(3)).isEqualTo("three");
        assertThat(map.containsKey(1)).isFalse();
        assertThat(map.size()).isEqualTo(2);
    }

    @Test
    void copyIsolatesValueUpdates() {
        var original = new HashedMap<String, Integer>();
        original.put("a", 1);
        var copy = new HashedMap<>(original);

        assertThat(copy.isShared()).isTrue();

        copy.put("a", 2);

        assertThat(original.get("a")).isEqualTo(1);
        assertThat(copy.get("a")).isEqualTo(2);
    }

    @Test
    void copyIsolatesUpdatesOfCollidingEntries() {
        var original = collidingMap();
        original.put(1, "one");
        original.put(2, "two");
        var copy = new HashedMap<>(original);

        copy.put(2, "deux");
        copy.getOrCreate(1).setValue("un");

        assertThat(original.get(1)).isEqualTo("one");
        assertThat(original.get(2)).isEqualTo("two");
        assertThat(copy.get(1)).isEqualTo("un");
        assertThat(copy.get(2)).isEqualTo("deux");
    }

    @Test
    void putAllCopiesEntries() {
        var source = new OrderedMap<String, Integer>();
        source.put("a", 1);
        source.put("b", 2);
        var map = new HashedMap<String, Integer>();

        map.putAll(source);

        assertThat(map).isEqualTo(source);
        assertThat(map.hashCode()).isEqualTo(source.hashCode());
    }

    @Test
    void moveTransplantsEntryFromAnotherMap() {
        var source = new HashedMap<String, Integer>();
        source.put("a", 1);
        source.put("b", 2);
        var target = new HashedMap<String, Integer>();
        var cursor = source.cursor();
        cursor.next();
        var key = cursor.item().key();

        assertThat(target.move(cursor, Direction.NONE)).isTrue();

        assertThat(target.containsKey(key)).isTrue();
        assertThat(source.containsKey(key)).isFalse();
        assertThat(source.size()).isEqualTo(1);
        assertThat(target.move(cursor, Direction.NONE)).isFalse();
    }

    @Test
    void capacityPresizesBuckets() {
        var map = new HashedMap<Integer, Integer>();

        map.capacity(1000);

        assertThat(map.bucketCount()).isEqualTo(2048);
    }

    @Test
    void clearEmptiesMap() {
        var map = new HashedMap<String, Integer>();
        map.put("a", 1);

        map.clear();

        assertThat(map.isEmpty()).isTrue();
        assertThat(map.get("a")).isNull();
    }

    @Test
    void rejectsNullKey() {
        var map = new HashedMap<String, Integer>();

        assertThatThrownBy(() -> map.put(null, 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toStringListsEntries() {
        var map = new HashedMap<String, Integer>();
        map.put("a", 1);

        assertThat(map).hasToString("{a=1}");
    }

    @Test
    void keysNeedNotBeComparable() {
        var map = new HashedMap<Point, String>();
        for (var i = 0; i < 20; i++) {
            map.put(new Point(i, -i), "p" + i);
        }

        assertThat(map.size()).isEqualTo(20);
        for (var i = 0; i < 20; i++) {
            assertThat(map.get(new Point(i, -i))).isEqualTo("p" + i);
        }
        assertThat(map.containsKey(new Point(1, 1))).isFalse();
    }

    @Test
    void collidingKeysWithoutComparatorStayReachable() {
        var map = new HashedMap<Point, String>(point -> 0, ContainerConfiguration.defaults());
        for (var i = 0; i < 5; i++) {
            map.put(new Point(i, i), "p" + i);
        }

        assertThat(map.remove(new Point(0, 0))).isTrue();
        map.put(new Point(3, 3), "updated");

        assertThat(map.size()).isEqualTo(4);
        assertThat(map.get(new Point(0, 0))).isNull();
        assertThat(map.get(new Point(1, 1))).isEqualTo("p1");
        assertThat(map.get(new Point(2, 2))).isEqualTo("p2");
        assertThat(map.get(new Point(3, 3))).isEqualTo("updated");
        assertThat(map.get(new Point(4, 4))).isEqualTo("p4");
    }
}
