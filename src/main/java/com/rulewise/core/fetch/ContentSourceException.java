package com.rulewise.core.fetch;

/**
 * Permanent failure reading one rule document. The item is omitted (or served
 * stale); other items are unaffected.
 */
public class ContentSourceException extends RuntimeException {

    private final String path;

    public ContentSourceException(String message, String path) {
        super(message);
        this.path = path;
    }

    public ContentSourceException(String message, String path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
