package com.rulewise.core.cache;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Cached rule document body and the instant it was fetched.
 * The body is copied on the way in and on the way out.
 */
public record CacheEntry(byte[] content, Instant fetchedAt) {

    public CacheEntry {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(fetchedAt, "fetchedAt");
        content = content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public String contentAsString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    public int size() {
        return content.length;
    }

    /** UTF-8 check without copying the body. */
    boolean isValidUtf8() {
        return RulesCache.isValidUtf8(content);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheEntry other)) return false;
        return Arrays.equals(content, other.content) && fetchedAt.equals(other.fetchedAt);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(content) + fetchedAt.hashCode();
    }

    @Override
    public String toString() {
        return "CacheEntry[size=" + content.length + ", fetchedAt=" + fetchedAt + "]";
    }
}
