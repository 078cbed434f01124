package com.rulewise.core.fetch;

/**
 * Failure that may succeed on a later attempt: rate limiting, server errors,
 * network errors and timeouts.
 */
public class TransientContentException extends ContentSourceException {

    public TransientContentException(String message, String path) {
        super(message, path);
    }

    public TransientContentException(String message, String path, Throwable cause) {
        super(message, path, cause);
    }
}
