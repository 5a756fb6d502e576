package com.rulesync.core.support;

/**
 * Expected content exists but could not be accessed, for example because of
 * file permissions. This differs from an absent path, which is treated as
 * empty content.
 *
 * @since 1.0.0
 */
public class ContentReadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ContentReadException(String message) {
        super(message);
    }

    public ContentReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
