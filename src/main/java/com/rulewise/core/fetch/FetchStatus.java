package com.rulewise.core.fetch;

/**
 * How a rule's content was resolved.
 */
public enum FetchStatus {
    /** Served from a live cache entry. */
    CACHED,
    /** Read from the content source. */
    FETCHED,
    /** Refetch failed; served an expired or evicted copy. */
    STALE,
    NOT_FOUND,
    FAILED,
    /** Still running when the deadline passed. */
    TIMED_OUT;

    public boolean hasContent() {
        return this == CACHED || this == FETCHED || this == STALE;
    }
}
