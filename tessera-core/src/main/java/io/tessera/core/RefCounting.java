package io.tessera.core;

/**
 * Reference count representation used by shared buffers.
 */
public enum RefCounting {
    /**
     * Plain integer counts. Containers sharing a buffer must be confined to one
     * thread or externally synchronized.
     */
    PLAIN,

    /**
     * Atomic counts, for callers that hand shared copies to other threads.
     * Mutation of a single container still requires external synchronization.
     */
    ATOMIC
}
