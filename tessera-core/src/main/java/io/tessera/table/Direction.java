package io.tessera.table;

/**
 * Where a cursor lands after {@link TableCursor#remove(Direction)}.
 */
public enum Direction {
    /** The cursor becomes invalid. */
    NONE,
    /** The cursor moves to the item that followed the removed one. */
    FORWARD,
    /** The cursor moves to the item that preceded the removed one. */
    REVERSE
}
