package io.tessera.sequence;

/**
 * Where the items visible through a {@link Sequence} live.
 */
public enum Storage {
    /** No data at all; distinct from empty. */
    NULL,

    /** Non-null with no items. A detached buffer may still be held for reuse. */
    EMPTY,

    /** Aliases a caller-owned array; the caller keeps it alive and unmodified. */
    EXTERNAL,

    /** Items live in a shared buffer referenced by this view. */
    BUFFERED
}
