package com.rulewise.core.fetch;

/**
 * The requested document does not exist. Never retried.
 */
public class ContentNotFoundException extends ContentSourceException {

    public ContentNotFoundException(String path) {
        super("Rule not found: " + path, path);
    }
}
