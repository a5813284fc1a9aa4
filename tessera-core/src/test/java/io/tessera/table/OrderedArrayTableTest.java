package io.tessera.table;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderedArrayTableTest {

    private static OrderedArrayTable<Integer, Integer> tableOf(int... keys) {
        var table = new OrderedArrayTable<Integer, Integer>(ItemPolicy.identity());
        for (var key : keys) {
            table.getOrInsert(key);
        }
        return table;
    }

    private static List<Integer> items(OrderedArrayTable<Integer, Integer> table) {
        var result = new ArrayList<Integer>();
        table.forEach(result::add);
        return result;
    }

    @Test
    void iteratesInKeyOrder() {
        var table = tableOf(5, 1, 3);

        assertThat(items(table)).containsExactly(1, 3, 5);
        assertThat(table.first()).isEqualTo(1);
        assertThat(table.last()).isEqualTo(5);
        assertThat(table.get(1)).isEqualTo(3);
    }

    @Test
    void duplicateKeysAreNotInserted() {
        var table = tableOf(2, 2, 1, 2);

        assertThat(table.size()).isEqualTo(2);
        assertThat(table.getOrInsert(1).created()).isFalse();
    }

    @Test
    void customComparatorControlsOrder() {
        var table = new OrderedArrayTable<String, String>(ItemPolicy.identity(), Comparator.reverseOrder());
        table.getOrInsert("a");
        table.getOrInsert("c");
        table.getOrInsert("b");

        var visited = new ArrayList<String>();
        table.forEach(visited::add);

        assertThat(visited).containsExactly("c", "b", "a");
    }

    @Test
    void findAndIndexOf() {
        var table = tableOf(10, 20, 30);

        assertThat(table.find(20)).isEqualTo(20);
        assertThat(table.find(25)).isNull();
        assertThat(table.indexOf(30)).isEqualTo(2);
        assertThat(table.indexOf(5)).isEqualTo(-1);
        assertThat(table.contains(10)).isTrue();
    }

    @Test
    void boundsLocateInsertionPoints() {
        var table = tableOf(10, 20, 30);

        assertThat(table.lowerBound(20)).isEqualTo(1);
        assertThat(table.upperBound(20)).isEqualTo(2);
        assertThat(table.lowerBound(25)).isEqualTo(2);
        assertThat(table.lowerBound(5)).isZero();
        assertThat(table.lowerBound(35)).isEqualTo(3);
        assertThat(table.upperBound(30)).isEqualTo(3);
    }

    @Test
    void boundCursorsIterateRange() {
        var table = tableOf(10, 20, 30, 40);
        var visited = new ArrayList<Integer>();

        var cursor = table.lowerBoundCursor(15);
        var end = table.upperBound(30);
        for (var i = table.lowerBound(15); i < end && cursor.isValid(); i++) {
            visited.add(cursor.item());
            cursor.next();
        }

        assertThat(visited).containsExactly(20, 30);
        assertThat(table.upperBoundCursor(40).isValid()).isFalse();
    }

    @Test
    void removeRangeDropsPositions() {
        var table = tableOf(1, 2, 3, 4, 5);

        assertThat(table.removeRange(1, 3)).isEqualTo(2);

        assertThat(items(table)).containsExactly(1, 4, 5);
        assertThat(table.removeRange(2, 10)).isEqualTo(1);
        assertThat(table.removeRange(3, 1)).isZero();
        assertThat(items(table)).containsExactly(1, 4);
    }

    @Test
    void removeAtAndRemoveByKey() {
        var table = tableOf(1, 2, 3, 4);

        assertThat(table.removeAt(0, 1)).isEqualTo(1);
        assertThat(table.remove(3)).isTrue();
        assertThat(table.remove(3)).isFalse();

        assertThat(items(table)).containsExactly(2, 4);
    }

    @Test
    void copySharesUntilWritten() {
        var original = tableOf(1, 2, 3);
        var copy = new OrderedArrayTable<>(original);

        assertThat(copy.isShared()).isTrue();

        copy.remove(2);
        copy.getOrInsert(0);

        assertThat(items(original)).containsExactly(1, 2, 3);
        assertThat(items(copy)).containsExactly(0, 1, 3);
        assertThat(original.isShared()).isFalse();
    }

    @Test
    void cursorRemoveRepositions() {
        var table = tableOf(1, 2, 3, 4);

        var forward = table.cursor(2);
        assertThat(forward.remove(Direction.FORWARD)).isEqualTo(2);
        assertThat(forward.item()).isEqualTo(3);

        var reverse = table.cursor(3);
        reverse.remove(Direction.REVERSE);
        assertThat(reverse.item()).isEqualTo(1);

        var none = table.cursor(4);
        none.remove(Direction.NONE);
        assertThat(none.isValid()).isFalse();
        assertThat(items(table)).containsExactly(1);
    }

    @Test
    void iteratorRemoveKeepsOrder() {
        var table = tableOf(1, 2, 3, 4, 5, 6);

        var iterator = table.iterator();
        while (iterator.hasNext()) {
            if (iterator.next() % 2 == 0) {
                iterator.remove();
            }
        }

        assertThat(items(table)).containsExactly(1, 3, 5);
    }

    @Test
    void capacityReservesRoom() {
        var table = tableOf(1);

        table.capacity(50);

        assertThat(table.capacity()).isGreaterThanOrEqualTo(50);
        assertThat(items(table)).containsExactly(1);
    }

    @Test
    void rejectsNullKey() {
        var table = tableOf(1);

        assertThatThrownBy(() -> table.remove(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> table.lowerBound(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cursorForAbsentKeyIsPastTheEnd() {
        var table = tableOf(10, 20, 30);

        var cursor = table.cursor(15);

        assertThat(cursor.isValid()).isFalse();
        assertThat(cursor.next()).isFalse();
        assertThat(cursor.previous()).isTrue();
        assertThat(cursor.item()).isEqualTo(30);
    }
}
