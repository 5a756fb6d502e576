package com.rulesync.core.model;

/**
 * A validated unit of content ready to be published under a name.
 *
 * <p>
 * Records are compared by name and {@linkplain #getPayload() payload}; the
 * payload is canonical JSON, so equal content always yields an equal string.
 * </p>
 *
 * @since 1.0.0
 */
public interface PublishRecord {

    /**
     * @return downstream identity derived from the relative file path
     */
    String getName();

    /**
     * @return canonical JSON payload
     */
    String getPayload();

    /**
     * @return path of the source file, relative to the kind's subpath
     */
    String getSourcePath();
}
