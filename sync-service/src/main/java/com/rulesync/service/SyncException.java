package com.rulesync.service;

import java.util.List;

/**
 * Raised when an external command used for syncing cannot be run or exits
 * with an error. Carries the command's diagnostic lines, if any.
 *
 * @since 1.0.0
 */
public class SyncException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> details;

    public SyncException(String message) {
        this(message, List.of(), null);
    }

    public SyncException(String message, List<String> details) {
        this(message, details, null);
    }

    public SyncException(String message, List<String> details, Throwable cause) {
        super(message, cause);
        this.details = List.copyOf(details);
    }

    /**
     * @return diagnostic lines (typically stderr); never {@code null}
     */
    public List<String> getDetails() {
        return details;
    }
}
