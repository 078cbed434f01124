package com.rulewise.core.fetch;

/**
 * Read-only access to rule documents by path and version selector.
 * <p>
 * Implementations enforce their own per-request timeout and classify failures:
 * <ul>
 *   <li>{@link ContentNotFoundException} when the document does not exist</li>
 *   <li>{@link TransientContentException} for failures worth retrying
 *       (rate limiting, server errors, network errors, timeouts)</li>
 *   <li>{@link ContentSourceException} for any other permanent failure</li>
 * </ul>
 */
public interface ContentSource {

    /**
     * @param path rule path, e.g. {@code base/code-quality.md}
     * @param ref  branch, tag or commit to read from
     * @return the raw document bytes
     */
    byte[] read(String path, String ref);

    /** Short human-readable description for logs and console output. */
    default String describe() {
        return getClass().getSimpleName();
    }
}
