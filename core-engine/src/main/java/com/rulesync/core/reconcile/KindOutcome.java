package com.rulesync.core.reconcile;

import com.rulesync.core.model.ContentDigest;
import com.rulesync.core.model.DownstreamKind;
import com.rulesync.core.model.FileError;
import com.rulesync.core.publish.PublishReport;

import java.util.List;
import java.util.Objects;

/**
 * What a reconcile pass did for one downstream kind.
 *
 * @since 1.0.0
 */
public final class KindOutcome {

    public enum Status {
        /** Content was loaded and published (possibly with zero writes). */
        PUBLISHED,
        /** Digest matched the last applied one; nothing was loaded. */
        UNCHANGED,
        /** No channel attached; retried once the channel joins. */
        DEFERRED,
        /** All records were removed because no source is configured. */
        CLEARED,
        /** The sync was not successful; published content left as is. */
        SKIPPED,
        /** Reading content or writing downstream failed; retried next pass. */
        FAILED
    }

    private final DownstreamKind kind;
    private final Status status;
    private final ContentDigest digest;
    private final PublishReport publishReport;
    private final List<FileError> errors;
    private final String message;

    KindOutcome(DownstreamKind kind, Status status, ContentDigest digest,
            PublishReport publishReport, List<FileError> errors, String message) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.digest = digest;
        this.publishReport = publishReport;
        this.errors = List.copyOf(errors);
        this.message = message == null ? "" : message;
    }

    static KindOutcome of(DownstreamKind kind, Status status, String message) {
        return new KindOutcome(kind, status, null, null, List.of(), message);
    }

    public DownstreamKind getKind() {
        return kind;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * @return content digest computed in this pass; {@code null} when the
     *         pass did not hash this kind
     */
    public ContentDigest getDigest() {
        return digest;
    }

    /**
     * @return the applied delta; {@code null} unless published or cleared
     */
    public PublishReport getPublishReport() {
        return publishReport;
    }

    /**
     * @return per-file errors, load errors first, then duplicates
     */
    public List<FileError> getErrors() {
        return errors;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "KindOutcome{kind=" + kind + ", status=" + status
                + ", errors=" + errors.size()
                + (message.isEmpty() ? "" : ", message='" + message + '\'') + '}';
    }
}
