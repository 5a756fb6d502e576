package com.rulesync.core.publish;

/**
 * A downstream write or read did not succeed. The whole kind is retried on
 * the next reconcile pass.
 *
 * @since 1.0.0
 */
public class PublishException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PublishException(String message) {
        super(message);
    }

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
