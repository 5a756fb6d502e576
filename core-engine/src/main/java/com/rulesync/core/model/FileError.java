package com.rulesync.core.model;

import java.util.Objects;

/**
 * A non-fatal problem attributed to one source file. The file is excluded
 * from publication; its siblings are not affected.
 *
 * @since 1.0.0
 */
public final class FileError {

    /** Category of a per-file problem. */
    public enum Type {
        /** The file could not be parsed or failed schema validation. */
        FILE_VALIDATION,
        /** The file maps to a record name already claimed by an earlier path. */
        DUPLICATE_IDENTITY,
        /** The file could not be read. */
        CONTENT_READ
    }

    private final DownstreamKind kind;
    private final String sourcePath;
    private final Type type;
    private final String message;

    public FileError(DownstreamKind kind, String sourcePath, Type type, String message) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.sourcePath = Objects.requireNonNull(sourcePath, "sourcePath must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.message = message;
    }

    public DownstreamKind getKind() {
        return kind;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public Type getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FileError that))
            return false;
        return kind == that.kind && type == that.type
                && sourcePath.equals(that.sourcePath)
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, sourcePath, type, message);
    }

    @Override
    public String toString() {
        return kind + ":" + sourcePath + " [" + type + "] " + message;
    }
}
