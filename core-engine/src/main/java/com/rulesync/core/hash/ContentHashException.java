package com.rulesync.core.hash;

import com.rulesync.core.support.ContentReadException;

/**
 * A file under a hashed subpath exists but could not be read.
 *
 * @since 1.0.0
 */
public class ContentHashException extends ContentReadException {

    private static final long serialVersionUID = 1L;

    public ContentHashException(String message, Throwable cause) {
        super(message, cause);
    }
}
