package com.rulewise.core.fetch;

/**
 * Per-item progress through the fetcher.
 * <pre>
 * PENDING --cache hit--> DONE
 * PENDING --miss-------> FETCHING --ok / not found / permanent--> DONE
 *                        FETCHING --transient--> RETRY --backoff--> FETCHING
 * </pre>
 */
public enum FetchState {
    PENDING,
    FETCHING,
    RETRY,
    DONE
}
