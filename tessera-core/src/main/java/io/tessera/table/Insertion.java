package io.tessera.table;

/**
 * Result of {@link AssociativeTable#getOrInsert(Object)}.
 *
 * @param item    the stored item, private to the table that returned it
 * @param created true if the item was created by this call
 */
public record Insertion<E>(E item, boolean created) {
}
