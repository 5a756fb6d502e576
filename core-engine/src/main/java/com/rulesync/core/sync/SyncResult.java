package com.rulesync.core.sync;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Last known outcome of the mirroring agent.
 *
 * <p>
 * Produced by a {@link SyncSupervisor}, read by the reconcile controller and
 * never modified afterwards.
 * </p>
 *
 * @since 1.0.0
 */
public final class SyncResult {

    public enum Outcome {
        /** Nothing has been mirrored yet. */
        PENDING,
        /** The mirror holds the revision reported by {@link #getRevision()}. */
        SUCCEEDED,
        /** The last attempt failed; the mirror keeps its previous content. */
        FAILED
    }

    private final Outcome outcome;
    private final String revision;
    private final Instant timestamp;
    private final String message;
    private final String output;
    private final List<String> details;

    private SyncResult(Outcome outcome, String revision, Instant timestamp,
            String message, String output, List<String> details) {
        this.outcome = outcome;
        this.revision = revision;
        this.timestamp = timestamp;
        this.message = message == null ? "" : message;
        this.output = output == null ? "" : output;
        this.details = List.copyOf(details);
    }

    public static SyncResult pending(String message) {
        return new SyncResult(Outcome.PENDING, null, null, message, null, List.of());
    }

    public static SyncResult succeeded(String revision, Instant timestamp) {
        return succeeded(revision, timestamp, null, List.of());
    }

    /**
     * @param revision  resolved revision of the mirrored content
     * @param timestamp when the mirror was last updated
     * @param output    captured standard output of a one-shot run
     * @param warnings  captured diagnostic lines of a one-shot run
     * @return a successful result
     */
    public static SyncResult succeeded(String revision, Instant timestamp, String output, List<String> warnings) {
        Objects.requireNonNull(revision, "revision must not be null");
        return new SyncResult(Outcome.SUCCEEDED, revision, timestamp, null, output, warnings);
    }

    public static SyncResult failed(String message, Instant timestamp) {
        return failed(message, timestamp, List.of());
    }

    /**
     * @param message   short failure description
     * @param timestamp when the failure was observed
     * @param details   diagnostic lines, for example the agent's stderr
     * @return a failed result
     */
    public static SyncResult failed(String message, Instant timestamp, List<String> details) {
        return new SyncResult(Outcome.FAILED, null, timestamp, message, null, details);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isSucceeded() {
        return outcome == Outcome.SUCCEEDED;
    }

    /**
     * @return resolved revision; {@code null} unless succeeded
     */
    public String getRevision() {
        return revision;
    }

    /**
     * @return time of the observed outcome; {@code null} when pending
     */
    public Instant getTimestamp() {
        return timestamp;
    }

    public String getMessage() {
        return message;
    }

    public String getOutput() {
        return output;
    }

    public List<String> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return "SyncResult{" +
                "outcome=" + outcome +
                ", revision='" + revision + '\'' +
                ", timestamp=" + timestamp +
                ", message='" + message + '\'' +
                '}';
    }
}
