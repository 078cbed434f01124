package com.rulewise.core.fetch;

import com.rulewise.core.model.RuleDescriptor;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Outcome of fetching one rule. {@code content} is {@code null} unless
 * {@link FetchStatus#hasContent()}; when present it is copied in and out.
 */
public record FetchResult(RuleDescriptor descriptor, FetchStatus status, byte[] content) {

    public FetchResult {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(status, "status");
        if (status.hasContent() && content == null) {
            throw new IllegalArgumentException(status + " result for " + descriptor.path() + " has no content");
        }
        content = status.hasContent() ? content.clone() : null;
    }

    public static FetchResult of(RuleDescriptor descriptor, FetchStatus status, byte[] content) {
        return new FetchResult(descriptor, status, content);
    }

    public static FetchResult empty(RuleDescriptor descriptor, FetchStatus status) {
        return new FetchResult(descriptor, status, null);
    }

    @Override
    public byte[] content() {
        return content == null ? null : content.clone();
    }

    public boolean hasContent() {
        return content != null;
    }

    public String contentAsString() {
        return content == null ? null : new String(content, StandardCharsets.UTF_8);
    }

    public String path() {
        return descriptor.path();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FetchResult other)) return false;
        return descriptor.equals(other.descriptor) && status == other.status
                && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(descriptor, status, Arrays.hashCode(content));
    }

    @Override
    public String toString() {
        return "FetchResult[path=" + descriptor.path() + ", status=" + status
                + ", size=" + (content == null ? 0 : content.length) + "]";
    }
}
